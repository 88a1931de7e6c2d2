package dev.vality.oauth.http.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vality.oauth.http.bridge.auth.OauthAuthenticationFilter;
import dev.vality.oauth.http.bridge.auth.OauthAuthenticator;
import dev.vality.oauth.http.bridge.properties.AuthServiceEndpoint;
import dev.vality.oauth.http.bridge.properties.OauthProperties;
import dev.vality.oauth.http.bridge.token.AccessTokenClient;
import dev.vality.oauth.http.bridge.token.AccessTokenExtractor;
import dev.vality.oauth.http.bridge.token.AccessTokenResponseInterpreter;
import dev.vality.oauth.http.bridge.token.QueryParamAccessTokenExtractor;
import dev.vality.oauth.http.bridge.token.RestAccessTokenClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Spring configuration that wires access token authentication into servlet based web applications that enable
 * {@code oauth-http-bridge}. Every bean backs off when the application declares its own.
 */
@Configuration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnProperty(value = "oauth-http-bridge.enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnClass({FilterRegistrationBean.class, OauthAuthenticationFilter.class})
@EnableConfigurationProperties(OauthProperties.class)
public class OauthAuthenticationConfig {

    /**
     * Resolves the authorization service location once, at startup.
     */
    @Bean
    @ConditionalOnMissingBean
    public AuthServiceEndpoint authServiceEndpoint(OauthProperties oauthProperties, Environment environment) {
        return AuthServiceEndpoint.resolve(oauthProperties, environment);
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessTokenClient accessTokenClient(AuthServiceEndpoint authServiceEndpoint) {
        return new RestAccessTokenClient(authServiceEndpoint);
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessTokenResponseInterpreter accessTokenResponseInterpreter() {
        return new AccessTokenResponseInterpreter();
    }

    /**
     * Registers the default query parameter extractor if the application has not overridden it.
     */
    @Bean
    @ConditionalOnMissingBean(AccessTokenExtractor.class)
    public AccessTokenExtractor accessTokenExtractor(OauthProperties oauthProperties) {
        return new QueryParamAccessTokenExtractor(oauthProperties.getAccessTokenParam());
    }

    @Bean
    @ConditionalOnMissingBean
    public OauthAuthenticator oauthAuthenticator(AccessTokenExtractor accessTokenExtractor,
                                                 AccessTokenClient accessTokenClient,
                                                 AccessTokenResponseInterpreter accessTokenResponseInterpreter) {
        return new OauthAuthenticator(accessTokenExtractor, accessTokenClient, accessTokenResponseInterpreter);
    }

    @Bean
    @ConditionalOnMissingBean
    public OauthAuthenticationFilter oauthAuthenticationFilter(OauthProperties oauthProperties,
                                                               OauthAuthenticator oauthAuthenticator,
                                                               ObjectProvider<ObjectMapper> objectMapper) {
        return new OauthAuthenticationFilter(oauthProperties, oauthAuthenticator,
                objectMapper.getIfAvailable(ObjectMapper::new));
    }

    /**
     * Registers the authentication filter within the servlet filter chain when custom registration is absent.
     */
    @Bean
    @ConditionalOnMissingBean(name = "oauthAuthenticationFilterRegistration")
    public FilterRegistrationBean<OauthAuthenticationFilter> oauthAuthenticationFilterRegistration(
            OauthAuthenticationFilter oauthAuthenticationFilter,
            OauthProperties oauthProperties) {
        var registrationBean = new FilterRegistrationBean<>(oauthAuthenticationFilter);
        registrationBean.setOrder(oauthProperties.getFilterOrder());
        registrationBean.setName("oauthAuthenticationFilter");
        registrationBean.addUrlPatterns("/*");
        return registrationBean;
    }
}
