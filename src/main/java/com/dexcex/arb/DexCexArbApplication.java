package com.dexcex.arb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DexCexArbApplication {

    public static void main(String[] args) {
        System.setProperty("java.net.preferIPv4Stack", "true"); // Often helpful for OkHttp
        SpringApplication.run(DexCexArbApplication.class, args);
    }

}
