package tech.yump.wrapper.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI wrapperOpenAPI(WrapperProperties wrapperProperties) {
        return new OpenAPI()
                .info(new Info()
                        .title(wrapperProperties.appName() + " API")
                        .version("v1")
                        .description("One-time secret wrapper (" + wrapperProperties.env() + "). "
                                + "A wrapped value can be unwrapped exactly once before it expires."));
    }
}
