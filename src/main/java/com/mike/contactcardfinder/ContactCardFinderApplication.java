package com.mike.contactcardfinder;

import com.mike.contactcardfinder.config.BehaviorProperties;
import com.mike.contactcardfinder.config.ContactFinderProperties;
import com.mike.contactcardfinder.config.ExtractionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ContactFinderProperties.class, BehaviorProperties.class, ExtractionProperties.class})
public class ContactCardFinderApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContactCardFinderApplication.class, args);
    }

}
