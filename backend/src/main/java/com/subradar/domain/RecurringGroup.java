package com.subradar.domain;

import lombok.Getter;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Transactions judged to belong to the same subscription or merchant during one analysis run.
 * Members are append-only until the group is frozen with its estimated frequency.
 */
@Getter
public class RecurringGroup {

    private final String key;
    private final String displayMerchant;
    private final List<TransactionRecord> members = new ArrayList<>();
    private Frequency frequency = Frequency.UNKNOWN;
    private boolean frozen;
    private String cancellationLink;
    private LinkSource linkSource;

    /**
     * @param key   normalized merchant key of the first record
     * @param first record that opened the group; its raw merchant becomes the display name
     */
    public RecurringGroup(String key, TransactionRecord first) {
        this.key = key != null ? key : "";
        this.displayMerchant = first.merchant();
        this.members.add(first);
    }

    public void add(TransactionRecord record) {
        if (frozen) {
            throw new IllegalStateException("Group " + key + " is frozen");
        }
        members.add(record);
    }

    /**
     * Replaces the members with {@code kept}, which must be a non-empty subset of them in member order.
     * The key and display name stay those of the opening record.
     */
    public void narrowTo(List<TransactionRecord> kept) {
        if (frozen) {
            throw new IllegalStateException("Group " + key + " is frozen");
        }
        if (kept == null || kept.isEmpty()) {
            throw new IllegalArgumentException("Group " + key + " cannot be narrowed to no members");
        }
        List<TransactionRecord> copy = new ArrayList<>(kept);
        members.clear();
        members.addAll(copy);
    }

    public List<TransactionRecord> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public int size() {
        return members.size();
    }

    /**
     * Arithmetic mean of member amounts. Recomputed on every call.
     */
    public BigDecimal getMonthlyCost() {
        BigDecimal sum = BigDecimal.ZERO;
        for (TransactionRecord member : members) {
            sum = sum.add(member.amount());
        }
        return sum.divide(BigDecimal.valueOf(members.size()), MathContext.DECIMAL128);
    }

    public void freeze(Frequency estimatedFrequency) {
        this.frequency = estimatedFrequency != null ? estimatedFrequency : Frequency.UNKNOWN;
        this.frozen = true;
    }

    public void attachLink(String url, LinkSource source) {
        this.cancellationLink = url;
        this.linkSource = source;
    }
}
