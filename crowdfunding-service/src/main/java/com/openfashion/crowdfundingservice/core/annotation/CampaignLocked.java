package com.openfashion.crowdfundingservice.core.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Serializes calls that mutate the same campaign. The annotated method must take a
 * {@code Long} parameter named {@code campaignId}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface CampaignLocked {
}
