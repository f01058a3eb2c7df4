package com.example.predictor.cpg;

import com.example.predictor.cpg.config.PredictorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PredictorProperties.class)
public class CpgPredictorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CpgPredictorApplication.class, args);
    }

}
