package com.fhi.dog_shelter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@SpringBootApplication
public class DogShelterApplication
{

    /**
     * Run with live reload (if you're doing dev)
     * $ mvn spring-boot:run -Dspring-boot.run.profiles=dev
     */
    public static void main(String[] args)
    {
        SpringApplication.run(DogShelterApplication.class, args);
        log.info("Dog shelter API started");
    }
}
