package dev.vality.oauth.http.bridge.autoconfigure;

import dev.vality.oauth.http.bridge.OauthAuthenticationConfig;
import dev.vality.oauth.http.bridge.OtelConfig;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.context.annotation.Import;

@AutoConfiguration(after = JacksonAutoConfiguration.class)
@Import({OauthAuthenticationConfig.class, OtelConfig.class})
public class OauthHttpBridgeAutoConfiguration {
}
