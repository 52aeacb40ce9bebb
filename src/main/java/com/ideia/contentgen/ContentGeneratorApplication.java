package com.ideia.contentgen;

import com.ideia.contentgen.config.AppProperties;
import com.ideia.contentgen.config.GeminiProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AppProperties.class, GeminiProperties.class})
public class ContentGeneratorApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(ContentGeneratorApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(app.run(args)));
    }
}
