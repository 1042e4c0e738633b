package com.walletscore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WalletScoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(WalletScoreApplication.class, args);
    }
}
