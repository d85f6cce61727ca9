package io.github.nabilcarel.oapivalidator.autoconfigure;

import io.github.nabilcarel.oapivalidator.config.OapiValidatorProperties;
import io.github.nabilcarel.oapivalidator.config.filter.OapiRequestValidatorFilter;
import io.github.nabilcarel.oapivalidator.model.OpenApiSpecification;
import io.github.nabilcarel.oapivalidator.model.ValidationOptions;
import io.github.nabilcarel.oapivalidator.service.*;
import io.github.nabilcarel.oapivalidator.writer.ErrorResponseWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@AutoConfiguration
@RequiredArgsConstructor
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnProperty(prefix = "oapi.validator", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(OapiValidatorProperties.class)
@Slf4j
public class OapiValidatorAutoConfiguration {
    private final OapiValidatorProperties properties;

    @Bean
    @ConditionalOnMissingBean
    public OpenApiSpecification oapiValidatorSpecification(ResourceLoader resourceLoader) {
        return new OpenApiSpecificationLoader(resourceLoader).load(properties.getSpecLocation());
    }

    @Bean
    @ConditionalOnMissingBean
    public ValidationOptions oapiValidationOptions(ObjectProvider<AuthenticationFunction> authenticationFunction) {
        return properties.toValidationOptions(
                authenticationFunction.getIfAvailable(CredentialPresenceAuthenticationFunction::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public OpenApiRouter oapiRouter(OpenApiSpecification specification) {
        return new AntPathOpenApiRouter(specification);
    }

    @Bean
    @ConditionalOnMissingBean
    public OpenApiRequestValidator oapiRequestValidator(OpenApiSpecification specification,
                                                        ValidationOptions options) {
        return new OpenApiRequestValidatorImpl(specification, options);
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestValidationService oapiRequestValidationService(OpenApiRouter router,
                                                                 OpenApiRequestValidator validator,
                                                                 ValidationOptions options) {
        return new RequestValidationServiceImpl(router, validator, options);
    }

    // Own mappers: registering an ObjectMapper bean would make Boot's JacksonAutoConfiguration back off
    @Bean
    @ConditionalOnMissingBean
    public ErrorResponseWriter oapiErrorResponseWriter(ValidationOptions options) {
        return new ErrorResponseWriter(options.getErrorResponseContentType());
    }

    @Bean
    public OapiRequestValidatorFilter oapiRequestValidatorFilter(RequestValidationService requestValidationService,
                                                                 ErrorResponseWriter errorResponseWriter,
                                                                 ValidationOptions options) {
        return new OapiRequestValidatorFilter(requestValidationService, errorResponseWriter, options);
    }

    @Bean
    public FilterRegistrationBean<OapiRequestValidatorFilter> oapiRequestValidatorFilterRegistration(
            OapiRequestValidatorFilter filter) {
        FilterRegistrationBean<OapiRequestValidatorFilter> registrationBean = new FilterRegistrationBean<>();
        registrationBean.setFilter(filter);
        registrationBean.setUrlPatterns(properties.getUrlPatterns());
        registrationBean.setOrder(properties.getFilterOrder());
        log.info("OpenAPI request validation enabled for {} using {}",
                properties.getUrlPatterns(), properties.getSpecLocation());
        return registrationBean;
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthIndicatorConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public OapiValidatorHealthIndicator oapiValidatorHealthIndicator(OpenApiSpecification specification) {
            return new OapiValidatorHealthIndicator(specification);
        }
    }
}
