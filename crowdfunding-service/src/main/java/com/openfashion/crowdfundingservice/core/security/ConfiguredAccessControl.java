package com.openfashion.crowdfundingservice.core.security;

import com.openfashion.crowdfundingservice.core.config.CrowdfundingProperties;
import com.openfashion.crowdfundingservice.core.util.Addresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Roles read from {@code crowdfunding.access}. The owner is implicitly an admin.
 */
@Component
@Slf4j
public class ConfiguredAccessControl implements AccessControl {

    private final String owner;
    private final Set<String> admins;

    public ConfiguredAccessControl(CrowdfundingProperties properties) {
        CrowdfundingProperties.Access access = properties.getAccess();
        this.owner = access.getOwner() == null || access.getOwner().isBlank() ? null : Addresses.normalize("crowdfunding.access.owner", access.getOwner());
        this.admins = access.getAdmins().stream()
                .map(a -> Addresses.normalize("crowdfunding.access.admins", a))
                .collect(Collectors.toUnmodifiableSet());

        if (owner == null) {
            log.warn("No platform owner configured, fee rate changes are disabled");
        }
        log.info("Access control initialised with {} admin(s)", admins.size());
    }

    @Override
    public boolean isAdmin(String address) {
        if (address == null) return false;
        String normalized = address.toLowerCase(Locale.ROOT);
        return admins.contains(normalized) || normalized.equals(owner);
    }

    @Override
    public boolean isOwner(String address) {
        return owner != null && owner.equalsIgnoreCase(address);
    }
}
