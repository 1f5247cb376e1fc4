package com.subradar.api.dto;

import com.subradar.analysis.AnalysisResult;

import java.math.BigDecimal;
import java.util.List;

/**
 * POST /api/v1/analyses response: groups in discovery order and their summed monthly cost.
 */
public record AnalysisResponse(List<AnnotatedGroupResponse> groups, BigDecimal totalMonthlySavings) {

    public static AnalysisResponse from(AnalysisResult result) {
        return new AnalysisResponse(
                result.groups().stream().map(AnnotatedGroupResponse::from).toList(),
                result.totalMonthlySavings());
    }
}
