package com.example.wheelcodereader;

import com.example.wheelcodereader.config.WheelRecognitionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(WheelRecognitionProperties.class)
public class WheelCodeReaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(WheelCodeReaderApplication.class, args);
    }
}
