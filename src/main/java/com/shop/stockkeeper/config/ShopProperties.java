package com.shop.stockkeeper.config;

import com.shop.stockkeeper.security.ItemMutationPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Application settings under the {@code shop.*} prefix.
 */
@Component
@ConfigurationProperties(prefix = "shop")
@Data
public class ShopProperties {

    private Bootstrap bootstrap = new Bootstrap();
    private Policy policy = new Policy();
    private Deployment deployment = new Deployment();

    @Data
    public static class Bootstrap {
        private String defaultShopName = "Default Shop";
        private String adminUsername = "admin";
        // Placeholder credential, change it after the first login.
        private String adminPassword = "admin";
    }

    @Data
    public static class Policy {
        private ItemMutationPolicy itemMutation = ItemMutationPolicy.ANY_USER;
    }

    @Data
    public static class Deployment {
        // Shell command run by the self-update action, e.g. "git pull --ff-only".
        private String updateCommand = "";
        private String workingDirectory = ".";
        private long timeoutSeconds = 300;
    }
}
