package com.zzf.codesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CodeSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeSyncApplication.class, args);
    }
}
