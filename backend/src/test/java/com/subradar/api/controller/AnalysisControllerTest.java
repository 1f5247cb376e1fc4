package com.subradar.api.controller;

import com.subradar.analysis.AnalysisResult;
import com.subradar.analysis.AnnotatedGroup;
import com.subradar.analysis.RecurringChargeAnalysisService;
import com.subradar.api.dto.AnalysisRequest;
import com.subradar.api.dto.TransactionRequest;
import com.subradar.domain.Frequency;
import com.subradar.domain.LinkSource;
import com.subradar.domain.TransactionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisControllerTest {

    @Mock
    private RecurringChargeAnalysisService analysisService;

    private AnalysisController controller;

    @BeforeEach
    void setUp() {
        controller = new AnalysisController(analysisService);
    }

    @Test
    @DisplayName("analysis result is mapped to a 200 response once the Mono is subscribed")
    void analyzeEmitsOkResponse() {
        AnnotatedGroup netflix = new AnnotatedGroup("netflix", "Netflix", new BigDecimal("15.49"),
                Frequency.MONTHLY, "https://www.netflix.com/cancelplan", LinkSource.KNOWN_MERCHANT,
                2, LocalDate.parse("2024-01-05"), LocalDate.parse("2024-02-05"));
        when(analysisService.analyze(anyList(), anyCollection())).thenReturn(AnalysisResult.of(List.of(netflix)));

        AnalysisRequest request = new AnalysisRequest(List.of(
                new TransactionRequest(LocalDate.parse("2024-01-05"), "Netflix", new BigDecimal("15.49")),
                new TransactionRequest(LocalDate.parse("2024-02-05"), "NETFLIX.COM", new BigDecimal("15.49"))),
                null);

        StepVerifier.create(controller.analyze(request))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                    assertThat(response.getBody()).isNotNull();
                    assertThat(response.getBody().groups()).hasSize(1);
                    assertThat(response.getBody().totalMonthlySavings()).isEqualByComparingTo("15.49");
                })
                .verifyComplete();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<TransactionRecord>> records = ArgumentCaptor.forClass(List.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<String>> exclusions = ArgumentCaptor.forClass(Collection.class);
        verify(analysisService).analyze(records.capture(), exclusions.capture());
        assertThat(records.getValue()).extracting(TransactionRecord::merchant)
                .containsExactly("Netflix", "NETFLIX.COM");
        assertThat(exclusions.getValue()).isEmpty();
    }

    @Test
    @DisplayName("service failure surfaces as an error signal")
    void analyzeErrorPropagates() {
        when(analysisService.analyze(anyList(), anyCollection())).thenThrow(new IllegalStateException("boom"));

        StepVerifier.create(controller.analyze(new AnalysisRequest(List.of(), List.of("Netflix"))))
                .expectError(IllegalStateException.class)
                .verify();
    }
}
