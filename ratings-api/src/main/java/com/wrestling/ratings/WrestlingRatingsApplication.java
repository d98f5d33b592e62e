package com.wrestling.ratings;

import com.wrestling.ratings.config.RatingsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RatingsProperties.class)
public class WrestlingRatingsApplication {

    public static void main(String[] args) {
        SpringApplication.run(WrestlingRatingsApplication.class, args);
    }
}
