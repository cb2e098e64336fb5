package com.phillippitts.council;

import com.phillippitts.council.config.properties.CostGovernorProperties;
import com.phillippitts.council.config.properties.CouncilProperties;
import com.phillippitts.council.config.properties.PipelineProperties;
import com.phillippitts.council.config.properties.ToolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        CouncilProperties.class,
        PipelineProperties.class,
        CostGovernorProperties.class,
        ToolProperties.class
})
@EnableScheduling
public class CouncilApplication {

    public static void main(String[] args) {
        SpringApplication.run(CouncilApplication.class, args);
    }

}
