/**
 * Quorum Bridge Service Application
 * Validator-attested cross-chain transfers with challenge and slashing
 */
package com.quorumbridge.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BridgeServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BridgeServiceApplication.class, args);
    }
}
