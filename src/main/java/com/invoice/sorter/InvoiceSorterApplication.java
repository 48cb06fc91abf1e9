package com.invoice.sorter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InvoiceSorterApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvoiceSorterApplication.class, args);
    }
}
