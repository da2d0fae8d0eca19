package com.bbthechange.mobilelogin.service;

import com.bbthechange.mobilelogin.dto.LanguageSetResponse;
import com.bbthechange.mobilelogin.dto.ProfileSetResponse;
import com.bbthechange.mobilelogin.dto.SetLanguageRequest;
import com.bbthechange.mobilelogin.dto.SetProfileRequest;
import com.bbthechange.mobilelogin.exception.InvalidTokenException;
import com.bbthechange.mobilelogin.exception.UnauthorizedException;
import com.bbthechange.mobilelogin.exception.ValidationException;
import com.bbthechange.mobilelogin.model.CredentialClaims;
import com.bbthechange.mobilelogin.model.LocaleUpdate;
import com.bbthechange.mobilelogin.model.ProfileUpdate;
import com.bbthechange.mobilelogin.model.User;
import com.bbthechange.mobilelogin.validation.ValidationFailure;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Profile and language updates for a logged-in user. Both require the bearer credential
 * issued at OTP verification, bound to the same mobile number.
 */
@Service
public class ProfileService {

    private static final Logger logger = LoggerFactory.getLogger(ProfileService.class);

    private final JwtService jwtService;
    private final UserDirectoryService userDirectory;
    private final ReferralCodeService referralCodeService;
    private final LocalizationService localizationService;
    private final ObjectMapper objectMapper;

    public ProfileService(JwtService jwtService,
                          UserDirectoryService userDirectory,
                          ReferralCodeService referralCodeService,
                          LocalizationService localizationService,
                          ObjectMapper objectMapper) {
        this.jwtService = jwtService;
        this.userDirectory = userDirectory;
        this.referralCodeService = referralCodeService;
        this.localizationService = localizationService;
        this.objectMapper = objectMapper;
    }

    public ProfileSetResponse setProfile(SetProfileRequest request) {
        String mobileNo = request.getMobileNo();
        authorize(request.getJwtToken(), mobileNo, request.getDeviceId());
        User current = userDirectory.find(mobileNo)
                .orElseThrow(() -> new UnauthorizedException("No user is registered for this mobile number"));

        String referredBy = null;
        if (request.getReferredBy() != null) {
            referredBy = referralCodeService.validateReferrer(request.getReferredBy());
            if (referredBy.equals(current.getReferralCode())) {
                throw new ValidationException(new ValidationFailure(ValidationFailure.INVALID_REFERRAL,
                        ValidationFailure.VALUE_ERROR, "referred_by",
                        "referred_by cannot be your own referral code", Map.of("referred_by", referredBy)));
            }
        }

        String fullName = request.getFullName().trim();
        String state = request.getState().trim();
        String profileData = toJson("profile_data", request.getProfileData());
        String currentCode = current.getReferralCode();
        String referrer = referredBy;

        // Keep an existing code unless the user asks for a specific one
        User updated;
        if (request.getReferralCode() == null && currentCode != null) {
            updated = storeProfile(mobileNo, new ProfileUpdate(fullName, state, null, referrer, profileData));
        } else {
            updated = referralCodeService.assign(request.getReferralCode(), mobileNo, code ->
                    storeProfile(mobileNo, new ProfileUpdate(fullName, state, code, referrer, profileData, currentCode)));
        }
        logger.info("Profile updated for user {}", updated.getUserId());

        return ProfileSetResponse.builder()
                .mobileNo(mobileNo)
                .userId(updated.getUserId())
                .userNumber(updated.getUserNumber())
                .fullName(updated.getFullName())
                .state(updated.getState())
                .referralCode(updated.getReferralCode())
                .referredBy(updated.getReferredBy())
                .build();
    }

    public LanguageSetResponse setLanguage(SetLanguageRequest request) {
        String mobileNo = request.getMobileNo();
        authorize(request.getJwtToken(), mobileNo, request.getDeviceId());

        LocaleUpdate update = new LocaleUpdate(request.getLanguageCode(), request.getLanguageName().trim(),
                request.getRegionCode(), request.getTimezone(), toJson("user_preferences", request.getUserPreferences()));
        User updated = userDirectory.updateLocale(mobileNo, update)
                .orElseThrow(() -> new UnauthorizedException("No user is registered for this mobile number"));
        logger.info("Language set to {} for user {}", updated.getLanguageCode(), updated.getUserId());

        return LanguageSetResponse.builder()
                .mobileNo(mobileNo)
                .userId(updated.getUserId())
                .languageCode(updated.getLanguageCode())
                .languageName(updated.getLanguageName())
                .regionCode(updated.getRegionCode())
                .timezone(updated.getTimezone())
                .localizedMessages(localizationService.messagesFor(updated.getLanguageCode(), updated.getRegionCode()))
                .build();
    }

    private User storeProfile(String mobileNo, ProfileUpdate update) {
        return userDirectory.updateProfile(mobileNo, update)
                .orElseThrow(() -> new UnauthorizedException("No user is registered for this mobile number"));
    }

    private CredentialClaims authorize(String token, String mobileNo, String deviceId) {
        CredentialClaims claims;
        try {
            claims = deviceId == null
                    ? jwtService.verify(token)
                    : jwtService.verifyWithDeviceBinding(token, deviceId, mobileNo);
        } catch (InvalidTokenException e) {
            throw new UnauthorizedException(e.getMessage());
        }
        if (!mobileNo.equals(claims.mobileNo())) {
            throw new UnauthorizedException("Credential was issued for a different mobile number");
        }
        return claims;
    }

    private String toJson(String field, Map<String, Object> value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException(new ValidationFailure(ValidationFailure.INVALID_FORMAT,
                    ValidationFailure.FORMAT_ERROR, field, field + " could not be stored", Map.of()));
        }
    }
}
