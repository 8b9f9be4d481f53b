// functions/energy-processor/src/main/java/dev/devanks/tuya/processor/EnergyProcessorApplication.java
package dev.devanks.tuya.processor;

import com.google.cloud.spring.data.firestore.repository.config.EnableReactiveFirestoreRepositories;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

@SpringBootApplication
@EnableFeignClients
@EnableReactiveFirestoreRepositories
public class EnergyProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnergyProcessorApplication.class, args);
    }
}
