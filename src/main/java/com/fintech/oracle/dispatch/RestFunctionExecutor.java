package com.fintech.oracle.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Executes functions through the function runtime's HTTP API:
 * {@code POST /functions/{functionId}/execute} with the parameters as the JSON body.
 */
public class RestFunctionExecutor implements FunctionExecutor {

    private static final Logger log = LoggerFactory.getLogger(RestFunctionExecutor.class);

    private final RestClient restClient;

    /**
     * @param restClient client whose base URL points at the function runtime
     */
    public RestFunctionExecutor(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public Object execute(String functionId, Map<String, Object> parameters) {
        log.debug("Executing function {} with {} parameter(s)", functionId, parameters.size());
        try {
            return restClient.post()
                .uri("/functions/{functionId}/execute", functionId)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(parameters)
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new FunctionExecutionException(functionId,
                "Function " + functionId + " execution failed: " + e.getMessage(), e);
        }
    }
}
