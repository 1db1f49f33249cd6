package com.vmreconciler.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "vmreconciler")
public class ReconcilerProperties {

    private String stateDir = System.getProperty("user.home") + "/.vm-reconciler/state";
    private boolean assumeYes = false;
    private Cloud cloud = new Cloud();
    private Provisioning provisioning = new Provisioning();
    private Ssh ssh = new Ssh();

    // -- delegating accessors --
    public String getCloudProvider() { return cloud.provider; }
    public Duration getPollInterval() { return Duration.ofMillis(provisioning.pollIntervalMillis); }
    public int getMaxPollAttempts() { return provisioning.maxPollAttempts; }
    public String getSshUser() { return ssh.user; }
    public List<String> getSshOptions() { return ssh.options; }
    public int getSshTimeoutSeconds() { return ssh.timeoutSeconds; }

    public String getStateDir() { return stateDir; }
    public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    public boolean isAssumeYes() { return assumeYes; }
    public void setAssumeYes(boolean assumeYes) { this.assumeYes = assumeYes; }
    public Cloud getCloud() { return cloud; }
    public void setCloud(Cloud cloud) { this.cloud = cloud; }
    public Provisioning getProvisioning() { return provisioning; }
    public void setProvisioning(Provisioning provisioning) { this.provisioning = provisioning; }
    public Ssh getSsh() { return ssh; }
    public void setSsh(Ssh ssh) { this.ssh = ssh; }

    public static class Cloud {
        /** {@code simulated} or {@code azure} */
        private String provider = "simulated";

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
    }

    public static class Provisioning {
        private long pollIntervalMillis = 1000;
        private int maxPollAttempts = 500;

        public long getPollIntervalMillis() { return pollIntervalMillis; }
        public void setPollIntervalMillis(long pollIntervalMillis) { this.pollIntervalMillis = pollIntervalMillis; }
        public int getMaxPollAttempts() { return maxPollAttempts; }
        public void setMaxPollAttempts(int maxPollAttempts) { this.maxPollAttempts = maxPollAttempts; }
    }

    public static class Ssh {
        private String user = "root";
        private List<String> options = new ArrayList<>(List.of(
                "-o", "BatchMode=yes",
                "-o", "StrictHostKeyChecking=accept-new"));
        private int timeoutSeconds = 60;

        public String getUser() { return user; }
        public void setUser(String user) { this.user = user; }
        public List<String> getOptions() { return options; }
        public void setOptions(List<String> options) { this.options = options; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
