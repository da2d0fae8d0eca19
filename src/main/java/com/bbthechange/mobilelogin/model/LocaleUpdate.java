package com.bbthechange.mobilelogin.model;

/**
 * Language and region attributes to overwrite on a user. Null components are left untouched.
 *
 * @param preferences free-form preference object serialized as JSON text
 */
public record LocaleUpdate(String languageCode, String languageName, String regionCode, String timezone,
                           String preferences) {
}
