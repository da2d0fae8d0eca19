package com.bbthechange.mobilelogin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LanguageSetResponse {

    @JsonProperty("mobile_no")
    private String mobileNo;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("language_code")
    private String languageCode;

    @JsonProperty("language_name")
    private String languageName;

    @JsonProperty("region_code")
    private String regionCode;

    @JsonProperty("timezone")
    private String timezone;

    // message key -> text in the newly selected language
    @JsonProperty("localized_messages")
    private Map<String, String> localizedMessages;
}
