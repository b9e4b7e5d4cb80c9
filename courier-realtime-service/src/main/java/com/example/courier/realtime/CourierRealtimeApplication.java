package com.example.courier.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@SpringBootApplication(scanBasePackages = "com.example.courier")
@EnableTransactionManagement
public class CourierRealtimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourierRealtimeApplication.class, args);
    }
}
