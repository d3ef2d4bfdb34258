package com.fragmentdl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("com.fragmentdl")
public class FragmentDownloaderApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(FragmentDownloaderApplication.class, args)));
    }
}
