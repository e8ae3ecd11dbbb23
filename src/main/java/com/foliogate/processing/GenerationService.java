package com.foliogate.processing;

import com.foliogate.security.TokenService;
import com.foliogate.shared.dto.GenerationRequest;
import com.foliogate.shared.dto.GenerationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs AI generation features through the {@link OperationGateway}.
 */
@Service
public class GenerationService {

    private static final Logger logger = LoggerFactory.getLogger(GenerationService.class);

    private final OperationGateway operationGateway;
    private final GenerationProvider generationProvider;
    private final TokenService tokenService;

    public GenerationService(OperationGateway operationGateway,
                             GenerationProvider generationProvider,
                             TokenService tokenService) {
        this.operationGateway = operationGateway;
        this.generationProvider = generationProvider;
        this.tokenService = tokenService;
    }

    /**
     * @param featureValue feature name from the request path
     * @throws IllegalArgumentException for an unknown feature
     */
    public GenerationResponse generate(String principalId, String featureValue, GenerationRequest request) {
        GenerationFeature feature = GenerationFeature.fromValue(featureValue);
        GenerationPrompt prompt = new GenerationPrompt(feature, request.getPrompt(), request.getTone());

        // Prompt text is never stored, only its fingerprint.
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("feature", feature.getValue());
        metadata.put("promptHash", tokenService.computeHmac(prompt.userText()));
        metadata.put("promptLength", prompt.userText().length());
        metadata.put("tone", prompt.tone());

        GatewayInvocation invocation = new GatewayInvocation(
                principalId, feature.getOperationClass(), feature.getValue(), metadata);

        logger.debug("Generation requested: principal={}, feature={}, promptLength={}",
                principalId, feature.getValue(), prompt.userText().length());
        OperationResult<String> result = operationGateway.invoke(invocation, () -> generationProvider.generate(prompt));

        CostReport cost = result.cost();
        String model = cost.model() != null ? cost.model() : generationProvider.modelName();
        return new GenerationResponse(result.output(),
                new GenerationResponse.Meta(model, feature.getValue(), cost.costEstimate()));
    }
}
