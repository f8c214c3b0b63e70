package com.titanic.inference.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.titanic.inference.security.TestTokens;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class PredictionControllerTest {
    private static final String WOMAN =
        "{\"pclass\":1,\"sex\":\"female\",\"age\":29,\"sibsp\":0,\"parch\":0,\"fare\":211.34,\"embarked\":\"S\"}";
    private static final String MAN =
        "{\"pclass\":3,\"sex\":\"male\",\"age\":22,\"sibsp\":1,\"parch\":0,\"fare\":7.25,\"embarked\":\"S\"}";

    @Autowired
    private MockMvc mockMvc;

    @DynamicPropertySource
    static void jwtKey(DynamicPropertyRegistry registry) {
        registry.add("inference.jwt.public-key", TestTokens::publicKeyPem);
    }

    @Test
    void predictsSurvivalForFirstClassWoman() throws Exception {
        predict("woman-1", WOMAN)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ensemble.label").value("survived"))
            .andExpect(jsonPath("$.ensemble.confidence_level").value("medium"))
            .andExpect(jsonPath("$.per_model.logistic_regression.label").value("survived"))
            .andExpect(jsonPath("$.per_model.decision_tree.label").value("survived"))
            .andExpect(jsonPath("$.request_id").exists())
            .andExpect(header().string("X-RateLimit-Limit", "10"))
            .andExpect(header().string("X-RateLimit-Remaining", "9"));
    }

    @Test
    void predictsDeathForThirdClassMan() throws Exception {
        predict("man-1", MAN)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ensemble.label").value("died"))
            .andExpect(jsonPath("$.ensemble.confidence_level").value("high"));
    }

    @Test
    void echoesRequestId() throws Exception {
        mockMvc.perform(post("/predict")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TestTokens.valid("echo-1"))
                .header("x-request-id", "req_client_42")
                .contentType(MediaType.APPLICATION_JSON)
                .content(WOMAN))
            .andExpect(status().isOk())
            .andExpect(header().string("x-request-id", "req_client_42"))
            .andExpect(jsonPath("$.request_id").value("req_client_42"));
    }

    @Test
    void rejectsMissingToken() throws Exception {
        mockMvc.perform(post("/predict").contentType(MediaType.APPLICATION_JSON).content(WOMAN))
            .andExpect(status().isUnauthorized())
            .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
            .andExpect(jsonPath("$.error.code").value("authentication_error"))
            .andExpect(jsonPath("$.error.reason").value("missing"));
    }

    @Test
    void rejectsExpiredToken() throws Exception {
        mockMvc.perform(post("/predict")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TestTokens.expired("late-1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(WOMAN))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error.reason").value("expired"));
    }

    @Test
    void reportsFieldErrors() throws Exception {
        predict("invalid-1", "{\"pclass\":5,\"sex\":\"female\",\"sibsp\":0,\"parch\":0}")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("validation_error"))
            .andExpect(jsonPath("$.error.field_errors.pclass[0]").value("must be 1, 2 or 3"));
    }

    @Test
    void rejectsMalformedJson() throws Exception {
        predict("broken-1", "{\"pclass\":")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void limitsRequestsPerUser() throws Exception {
        for (int i = 0; i < 10; i++) {
            predict("burst-1", MAN).andExpect(status().isOk());
        }

        predict("burst-1", MAN)
            .andExpect(status().isTooManyRequests())
            .andExpect(header().exists(HttpHeaders.RETRY_AFTER))
            .andExpect(header().string("X-RateLimit-Remaining", "0"))
            .andExpect(jsonPath("$.error.code").value("rate_limit_exceeded"));

        predict("burst-2", MAN).andExpect(status().isOk());
    }

    @Test
    void healthNeedsNoToken() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void unknownRouteIsNotFound() throws Exception {
        mockMvc.perform(get("/no-such-route"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.code").value("not_found"));
    }

    @Test
    void malformedHealthFlagIsBadRequest() throws Exception {
        mockMvc.perform(get("/health").param("detailed", "yes-please"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void missingAgeIsReported() throws Exception {
        predict("no-age-1", "{\"pclass\":1,\"sex\":\"female\",\"sibsp\":0,\"parch\":0,\"fare\":211.34,\"embarked\":\"S\"}")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.field_errors.age[0]").value("is required"));
    }

    @Test
    void describesModels() throws Exception {
        mockMvc.perform(get("/models/info")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TestTokens.valid("info-1")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.loading_mode").value("lazy"))
            .andExpect(jsonPath("$.models.length()").value(2))
            .andExpect(jsonPath("$.ensemble_accuracy").value(0.816))
            .andExpect(jsonPath("$.feature_columns.length()").value(10))
            .andExpect(header().string("X-RateLimit-Limit", "30"));
    }

    private ResultActions predict(String userId, String body) throws Exception {
        return mockMvc.perform(post("/predict")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + TestTokens.valid(userId))
            .contentType(MediaType.APPLICATION_JSON)
            .content(body));
    }
}
