package com.what3words.geocoding;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class W3wGeocodingApplication {

    public static void main(String[] args) {
        SpringApplication.run(W3wGeocodingApplication.class, args);
    }
}
