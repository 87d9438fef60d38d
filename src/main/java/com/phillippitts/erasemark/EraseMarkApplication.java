package com.phillippitts.erasemark;

import com.phillippitts.erasemark.config.inpaint.ChainProperties;
import com.phillippitts.erasemark.config.inpaint.ClassicalConfig;
import com.phillippitts.erasemark.config.inpaint.CloudConfig;
import com.phillippitts.erasemark.config.inpaint.DetectorConfig;
import com.phillippitts.erasemark.config.inpaint.LocalModelConfig;
import com.phillippitts.erasemark.config.inpaint.MaskProperties;
import com.phillippitts.erasemark.config.inpaint.PatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        LocalModelConfig.class,
        CloudConfig.class,
        ClassicalConfig.class,
        ChainProperties.class,
        DetectorConfig.class,
        MaskProperties.class,
        PatchProperties.class
})
public class EraseMarkApplication {

    public static void main(String[] args) {
        SpringApplication.run(EraseMarkApplication.class, args);
    }

}
