package com.foliogate.processing;

import com.foliogate.security.TokenService;
import com.foliogate.shared.dto.GenerationRequest;
import com.foliogate.shared.dto.GenerationResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GenerationServiceTest {

    private OperationGateway operationGateway;
    private GenerationService generationService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        operationGateway = mock(OperationGateway.class);
        // Run the operation directly, as an always-allowing gateway would.
        when(operationGateway.invoke(any(GatewayInvocation.class), any(GatedOperation.class)))
                .thenAnswer(invocation -> ((GatedOperation<String>) invocation.getArgument(1)).execute());
        generationService = new GenerationService(operationGateway, new StubGenerationProvider(),
                new TokenService("test-secret"));
    }

    @Test
    void rewriteIsBilledToRewriteClass() {
        GenerationResponse response = generationService.generate("u1", "rewrite",
                new GenerationRequest("Led a team of five engineers.", "confident"));

        ArgumentCaptor<GatewayInvocation> captor = ArgumentCaptor.forClass(GatewayInvocation.class);
        verify(operationGateway).invoke(captor.capture(), any());
        GatewayInvocation sent = captor.getValue();
        assertThat(sent.principalId()).isEqualTo("u1");
        assertThat(sent.operationClass()).isEqualTo(GenerationFeature.AI_REWRITE);
        assertThat(sent.feature()).isEqualTo("rewrite");

        assertThat(response.getResult()).startsWith("[stub rewrite, confident] Led a team");
        assertThat(response.getMeta().getModel()).isEqualTo(StubGenerationProvider.MODEL);
        assertThat(response.getMeta().getCostEstimate()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void promptTextIsFingerprintedNotStored() {
        String prompt = "Seven years of backend experience at a payments company.";

        generationService.generate("u1", "summary", new GenerationRequest(prompt, null));

        ArgumentCaptor<GatewayInvocation> captor = ArgumentCaptor.forClass(GatewayInvocation.class);
        verify(operationGateway).invoke(captor.capture(), any());
        GatewayInvocation sent = captor.getValue();
        assertThat(sent.operationClass()).isEqualTo(GenerationFeature.AI_GENERATION);
        assertThat(sent.metadata())
                .containsEntry("feature", "summary")
                .containsEntry("promptLength", prompt.length())
                .containsEntry("tone", "professional")
                .containsKey("promptHash");
        assertThat(sent.metadata().values()).doesNotContain(prompt);
    }

    @Test
    void unknownFeatureIsRejectedBeforeTheGateway() {
        assertThatThrownBy(() -> generationService.generate("u1", "poetry", new GenerationRequest("x", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("poetry");
        verifyNoInteractions(operationGateway);
    }
}
