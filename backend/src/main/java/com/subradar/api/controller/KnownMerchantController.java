package com.subradar.api.controller;

import com.subradar.api.dto.AddKnownMerchantRequest;
import com.subradar.linking.table.KnownMerchantTable;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/known-merchants")
@RequiredArgsConstructor
public class KnownMerchantController {

    private final KnownMerchantTable knownMerchantTable;

    @PostMapping
    public ResponseEntity<Void> add(@Valid @RequestBody AddKnownMerchantRequest request) {
        knownMerchantTable.addMerchant(request.name().strip(), request.url().strip(), request.save());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }
}
