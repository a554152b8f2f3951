package com.openfashion.crowdfundingservice.core.security;

/**
 * Identity and role checks consulted by the campaign core.
 */
public interface AccessControl {

    boolean isAdmin(String address);

    boolean isOwner(String address);
}
