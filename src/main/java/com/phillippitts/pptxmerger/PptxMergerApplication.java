package com.phillippitts.pptxmerger;

import com.phillippitts.pptxmerger.config.properties.MergeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MergeProperties.class)
public class PptxMergerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PptxMergerApplication.class, args)));
    }

}
