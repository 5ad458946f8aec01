package com.musicgroups.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Application settings. Define them in application.yml under 'musicgroups'.
 */
@Configuration
@ConfigurationProperties(prefix = "musicgroups")
public class MusicGroupsConfig {

    private int pageSize = 10;
    private int maxVisiblePages = 10;
    private int defaultSeedCount = 100;
    private List<UserDefinition> users = new ArrayList<>();

    public int getPageSize() { return pageSize; }
    public void setPageSize(int pageSize) { this.pageSize = pageSize; }

    public int getMaxVisiblePages() { return maxVisiblePages; }
    public void setMaxVisiblePages(int maxVisiblePages) { this.maxVisiblePages = maxVisiblePages; }

    public int getDefaultSeedCount() { return defaultSeedCount; }
    public void setDefaultSeedCount(int defaultSeedCount) { this.defaultSeedCount = defaultSeedCount; }

    public List<UserDefinition> getUsers() { return users; }
    public void setUsers(List<UserDefinition> users) { this.users = users; }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class UserDefinition {
        private String username;
        private String password;
        private List<String> roles = new ArrayList<>(List.of("USER"));

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public List<String> getRoles() { return roles; }
        public void setRoles(List<String> roles) { this.roles = roles; }
    }
}
