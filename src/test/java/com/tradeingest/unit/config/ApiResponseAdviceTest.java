package com.tradeingest.unit.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeingest.api.controller.FormatController;
import com.tradeingest.config.ApiResponseAdvice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;

/** Unit tests for which controller bodies get the success envelope. */
class ApiResponseAdviceTest {

    private final ApiResponseAdvice advice = new ApiResponseAdvice();

    @Test
    @DisplayName("Bodies of the API controllers are wrapped")
    void wrapsApiControllers() throws Exception {
        MethodParameter list = new MethodParameter(FormatController.class.getMethod("list"), -1);

        assertThat(advice.supports(list, MappingJackson2HttpMessageConverter.class)).isTrue();
    }

    @Test
    @DisplayName("Handlers outside the API package are left alone")
    void skipsOtherHandlers() throws Exception {
        MethodParameter other = new MethodParameter(Object.class.getMethod("toString"), -1);

        assertThat(advice.supports(other, MappingJackson2HttpMessageConverter.class)).isFalse();
    }
}
