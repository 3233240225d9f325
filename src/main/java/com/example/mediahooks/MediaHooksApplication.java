package com.example.mediahooks;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediaHooksApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaHooksApplication.class, args);
    }

}
