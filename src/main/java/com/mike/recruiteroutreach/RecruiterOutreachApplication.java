package com.mike.recruiteroutreach;

import com.mike.recruiteroutreach.config.DirectoryProperties;
import com.mike.recruiteroutreach.config.OutreachProperties;
import com.mike.recruiteroutreach.config.RecruiterFinderProperties;
import com.mike.recruiteroutreach.config.SearchBackendProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties({
        RecruiterFinderProperties.class,
        OutreachProperties.class,
        SearchBackendProperties.class,
        DirectoryProperties.class
})
public class RecruiterOutreachApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecruiterOutreachApplication.class, args);
    }

}
