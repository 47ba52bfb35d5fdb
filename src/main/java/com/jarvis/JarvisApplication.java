package com.jarvis;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
public class JarvisApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(JarvisApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
