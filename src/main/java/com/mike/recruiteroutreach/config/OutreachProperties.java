package com.mike.recruiteroutreach.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "outreach")
public class OutreachProperties {

    private boolean enabled = true;

    private String fromAddress;

    /**
     * Display name in the From: header and signature after "Best,".
     */
    private String fromName;

    private int maxSendPerRun = 3;

    private long delayBetweenEmailsMillis = 2000;

    /**
     * Window in which a missing bounce notification counts as tentative delivery.
     */
    private int bounceLookbackMinutes = 30;

    private int bounceWaitSeconds = 120;

    /**
     * Optional PDF attached to every outreach email.
     */
    private String resumePath;

    private BounceCron bounceCron = new BounceCron();
    private Imap imap = new Imap();

    @Data
    public static class BounceCron {
        private boolean enabled = false;
        private long intervalMillis = 900000;
    }

    @Data
    public static class Imap {
        private String host;
        private int port = 993;
        private String username;
        private String password;
        private String folder = "INBOX";
    }
}
