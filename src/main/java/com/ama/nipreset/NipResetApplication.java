package com.ama.nipreset;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.ama.nipreset.config.NipResetProperties;

/**
 * AMA Reset NIP API
 *
 * Lets a customer replace the 4-digit NIP of one of their vehicles through a
 * single-use, time-boxed link sent to the registered email. The new NIP is never
 * stored here: it is handed off to the system of record through a signed webhook.
 */
@SpringBootApplication
@EnableConfigurationProperties(NipResetProperties.class)
public class NipResetApplication {

    public static void main(String[] args) {
        SpringApplication.run(NipResetApplication.class, args);
    }
}
