package com.tracegate.core.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tracegate.store")
public class StoreProperties {

    /** {@code memory} or {@code jdbc}. */
    private String type = "memory";

    /** Classpath or file location of a JSON graph snapshot loaded into the in-memory store. */
    private String seedFile = "";

    private final Jdbc jdbc = new Jdbc();

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getSeedFile() {
        return seedFile;
    }

    public void setSeedFile(String seedFile) {
        this.seedFile = seedFile;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public boolean isJdbc() {
        return "jdbc".equalsIgnoreCase(type);
    }

    public boolean hasSeedFile() {
        return seedFile != null && !seedFile.isBlank();
    }

    public static class Jdbc {

        private String url = "";
        private String username = "";
        private String password = "";
        private int maximumPoolSize = 5;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getMaximumPoolSize() {
            return maximumPoolSize;
        }

        public void setMaximumPoolSize(int maximumPoolSize) {
            this.maximumPoolSize = maximumPoolSize;
        }
    }
}
