package com.phillippitts.classmate;

import com.phillippitts.classmate.config.properties.AnalysisProperties;
import com.phillippitts.classmate.config.properties.AudioCaptureProperties;
import com.phillippitts.classmate.config.properties.EventBusProperties;
import com.phillippitts.classmate.config.properties.LlmProperties;
import com.phillippitts.classmate.config.properties.NotificationProperties;
import com.phillippitts.classmate.config.properties.SessionStoreProperties;
import com.phillippitts.classmate.config.properties.ThreadPoolProperties;
import com.phillippitts.classmate.config.properties.TranscriptionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ThreadPoolProperties.class,
        EventBusProperties.class,
        TranscriptionProperties.class,
        LlmProperties.class,
        AnalysisProperties.class,
        SessionStoreProperties.class,
        AudioCaptureProperties.class,
        NotificationProperties.class
})
public class ClassmateApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClassmateApplication.class, args);
    }

}
