package com.bbthechange.mobilelogin.validation;

import com.bbthechange.mobilelogin.dto.DeviceInfoRequest;
import com.bbthechange.mobilelogin.dto.LoginRequest;
import com.bbthechange.mobilelogin.dto.SetLanguageRequest;
import com.bbthechange.mobilelogin.dto.SetProfileRequest;
import com.bbthechange.mobilelogin.dto.VerifyOtpRequest;
import com.bbthechange.mobilelogin.exception.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.bbthechange.mobilelogin.testutil.TestConstants.DEVICE_ID;
import static com.bbthechange.mobilelogin.testutil.TestConstants.FCM_TOKEN;
import static com.bbthechange.mobilelogin.testutil.TestConstants.MOBILE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("RequestValidator Tests")
class RequestValidatorTest {

    private static ValidatorFactory validatorFactory;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RequestValidator requestValidator;

    @BeforeAll
    static void createFactory() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void closeFactory() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        requestValidator = new RequestValidator(objectMapper, validatorFactory.getValidator());
    }

    private ObjectNode validLogin() {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("mobile_no", MOBILE);
        data.put("device_id", DEVICE_ID);
        data.put("fcm_token", FCM_TOKEN);
        return data;
    }

    private ValidationFailure failureFor(String event, ObjectNode data, Class<?> type) {
        ValidationException e = catchThrowableOfType(
                () -> requestValidator.validate(event, data, type), ValidationException.class);
        assertThat(e).as("expected %s to be rejected", data).isNotNull();
        return e.getFailure();
    }

    @Nested
    @DisplayName("Payload shape")
    class ShapeTests {

        @Test
        void nonObjectPayload_isInvalidFormatOnRoot() {
            ValidationException e = catchThrowableOfType(
                    () -> requestValidator.validate("login", objectMapper.getNodeFactory().textNode("hi"),
                            LoginRequest.class),
                    ValidationException.class);

            assertThat(e.getFailure().code()).isEqualTo(ValidationFailure.INVALID_FORMAT);
            assertThat(e.getFailure().errorType()).isEqualTo(ValidationFailure.FORMAT_ERROR);
            assertThat(e.getFailure().field()).isEqualTo("root");
            assertThat(e.getFailure().details()).containsEntry("received_type", "string");
        }

        @Test
        void missingPayload_isInvalidFormatOnRoot() {
            ValidationException e = catchThrowableOfType(
                    () -> requestValidator.validate("login", null, LoginRequest.class), ValidationException.class);

            assertThat(e.getFailure().code()).isEqualTo(ValidationFailure.INVALID_FORMAT);
        }

        @Test
        void unknownFieldsAreIgnored() {
            ObjectNode data = validLogin();
            data.put("app_build", 42);

            LoginRequest request = requestValidator.validate("login", data, LoginRequest.class);

            assertThat(request.getMobileNo()).isEqualTo(MOBILE);
            assertThat(request.getFcmToken()).isEqualTo(FCM_TOKEN);
        }
    }

    @Nested
    @DisplayName("login payload")
    class LoginTests {

        @Test
        void missingMobile_isMissingField() {
            ObjectNode data = validLogin();
            data.remove("mobile_no");

            ValidationFailure failure = failureFor("login", data, LoginRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.MISSING_FIELD);
            assertThat(failure.errorType()).isEqualTo(ValidationFailure.FIELD_ERROR);
            assertThat(failure.field()).isEqualTo("mobile_no");
        }

        @Test
        void numericMobile_isInvalidType() {
            ObjectNode data = validLogin();
            data.put("mobile_no", 9876543210L);

            ValidationFailure failure = failureFor("login", data, LoginRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.INVALID_TYPE);
            assertThat(failure.errorType()).isEqualTo(ValidationFailure.TYPE_ERROR);
            assertThat(failure.details()).containsEntry("expected_type", "string")
                    .containsEntry("received_type", "number")
                    .containsEntry("required", true);
        }

        @Test
        void emptyMobile_isEmptyFieldRatherThanLength() {
            ObjectNode data = validLogin();
            data.put("mobile_no", "");

            ValidationFailure failure = failureFor("login", data, LoginRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.EMPTY_FIELD);
            assertThat(failure.errorType()).isEqualTo(ValidationFailure.VALUE_ERROR);
        }

        @Test
        void shortMobile_isInvalidLengthWithBounds() {
            ObjectNode data = validLogin();
            data.put("mobile_no", "12345");

            ValidationFailure failure = failureFor("login", data, LoginRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.INVALID_LENGTH);
            assertThat(failure.errorType()).isEqualTo(ValidationFailure.LENGTH_ERROR);
            assertThat(failure.details()).containsEntry("min_length", 10)
                    .containsEntry("max_length", 15)
                    .containsEntry("received_length", 5);
        }

        @Test
        void mobileWithLetters_isInvalidFormat() {
            ObjectNode data = validLogin();
            data.put("mobile_no", "98765abcde");

            ValidationFailure failure = failureFor("login", data, LoginRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.INVALID_FORMAT);
            assertThat(failure.field()).isEqualTo("mobile_no");
        }

        @Test
        void deviceIdWithSpaces_isInvalidFormat() {
            ObjectNode data = validLogin();
            data.put("device_id", "my device");

            assertThat(failureFor("login", data, LoginRequest.class).field()).isEqualTo("device_id");
        }

        @Test
        void shortPushToken_isInvalidLength() {
            ObjectNode data = validLogin();
            data.put("fcm_token", "short");

            ValidationFailure failure = failureFor("login", data, LoginRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.INVALID_LENGTH);
            assertThat(failure.field()).isEqualTo("fcm_token");
        }

        @Test
        void badEmail_isInvalidFormat() {
            ObjectNode data = validLogin();
            data.put("email", "not-an-email");

            ValidationFailure failure = failureFor("login", data, LoginRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.INVALID_FORMAT);
            assertThat(failure.field()).isEqualTo("email");
        }

        @Test
        void timestampWithoutZulu_isInvalidFormat() {
            ObjectNode data = validLogin();
            data.put("timestamp", "2024-01-15 10:30:00");

            assertThat(failureFor("login", data, LoginRequest.class).field()).isEqualTo("timestamp");
        }

        @Test
        void firstDeclaredFieldIsReported() {
            ObjectNode data = objectMapper.createObjectNode();

            assertThat(failureFor("login", data, LoginRequest.class).field()).isEqualTo("mobile_no");
        }

        @Test
        void validPayload_bindsAllFields() {
            ObjectNode data = validLogin();
            data.put("email", "user@example.com");
            data.put("timestamp", "2024-01-15T10:30:00Z");

            LoginRequest request = requestValidator.validate("login", data, LoginRequest.class);

            assertThat(request.getDeviceId()).isEqualTo(DEVICE_ID);
            assertThat(request.getEmail()).isEqualTo("user@example.com");
        }
    }

    @Nested
    @DisplayName("verify:otp payload")
    class VerifyOtpTests {

        private ObjectNode validVerify() {
            ObjectNode data = objectMapper.createObjectNode();
            data.put("mobile_no", MOBILE);
            data.put("otp", "123456");
            data.put("session_token", "token");
            return data;
        }

        @Test
        void fiveDigitOtp_isInvalidLength() {
            ObjectNode data = validVerify();
            data.put("otp", "12345");

            ValidationFailure failure = failureFor("verify:otp", data, VerifyOtpRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.INVALID_LENGTH);
            assertThat(failure.field()).isEqualTo("otp");
        }

        @Test
        void nonDigitOtp_isInvalidFormat() {
            ObjectNode data = validVerify();
            data.put("otp", "12a456");

            assertThat(failureFor("verify:otp", data, VerifyOtpRequest.class).code())
                    .isEqualTo(ValidationFailure.INVALID_FORMAT);
        }

        @Test
        void blankSessionToken_isEmptyField() {
            ObjectNode data = validVerify();
            data.put("session_token", "   ");

            ValidationFailure failure = failureFor("verify:otp", data, VerifyOtpRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.EMPTY_FIELD);
            assertThat(failure.field()).isEqualTo("session_token");
        }
    }

    @Nested
    @DisplayName("set:profile and set:language payloads")
    class ProfileAndLanguageTests {

        private ObjectNode validProfile() {
            ObjectNode data = objectMapper.createObjectNode();
            data.put("mobile_no", MOBILE);
            data.put("session_token", "token");
            data.put("jwt_token", "jwt");
            data.put("full_name", "Asha Rao");
            data.put("state", "Karnataka");
            return data;
        }

        @Test
        void fullNameWithoutLetters_isInvalidFormat() {
            ObjectNode data = validProfile();
            data.put("full_name", "12345");

            ValidationFailure failure = failureFor("set:profile", data, SetProfileRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.INVALID_FORMAT);
            assertThat(failure.field()).isEqualTo("full_name");
        }

        @Test
        void referralCodeWithSymbols_isInvalidFormat() {
            ObjectNode data = validProfile();
            data.put("referral_code", "AB#12");

            assertThat(failureFor("set:profile", data, SetProfileRequest.class).field()).isEqualTo("referral_code");
        }

        @Test
        void profileDataMustBeObject() {
            ObjectNode data = validProfile();
            data.putArray("profile_data").add("x");

            ValidationFailure failure = failureFor("set:profile", data, SetProfileRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.INVALID_TYPE);
            assertThat(failure.details()).containsEntry("expected_type", "object")
                    .containsEntry("received_type", "array")
                    .containsEntry("required", false);
        }

        @Test
        @DisplayName("Several failing fields report the one declared first, whatever its JSON name")
        void missingStateAndFullName_reportsFullNameFirst() {
            ObjectNode data = validProfile();
            data.remove("state");
            data.remove("full_name");

            ValidationFailure failure = failureFor("set:profile", data, SetProfileRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.MISSING_FIELD);
            assertThat(failure.field()).isEqualTo("full_name");
        }

        @Test
        void wrongTypeOnOptionalField_isNotRequired() {
            ObjectNode data = validProfile();
            data.put("referral_code", 1234);

            ValidationFailure failure = failureFor("set:profile", data, SetProfileRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.INVALID_TYPE);
            assertThat(failure.field()).isEqualTo("referral_code");
            assertThat(failure.details()).containsEntry("required", false);
        }

        @Test
        void missingJwt_isMissingField() {
            ObjectNode data = validProfile();
            data.remove("jwt_token");

            assertThat(failureFor("set:profile", data, SetProfileRequest.class).field()).isEqualTo("jwt_token");
        }

        @Test
        void validProfile_bindsNestedProfileData() {
            ObjectNode data = validProfile();
            data.putObject("profile_data").put("bio", "hello");

            SetProfileRequest request = requestValidator.validate("set:profile", data, SetProfileRequest.class);

            assertThat(request.getProfileData()).containsEntry("bio", "hello");
            assertThat(request.getReferralCode()).isNull();
        }

        @Test
        void uppercaseLanguageCode_isInvalidFormat() {
            ObjectNode data = objectMapper.createObjectNode();
            data.put("mobile_no", MOBILE);
            data.put("session_token", "token");
            data.put("jwt_token", "jwt");
            data.put("language_code", "EN");
            data.put("language_name", "English");

            ValidationFailure failure = failureFor("set:language", data, SetLanguageRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.INVALID_FORMAT);
            assertThat(failure.field()).isEqualTo("language_code");
        }

        @Test
        void lowercaseRegion_isInvalidFormat() {
            ObjectNode data = objectMapper.createObjectNode();
            data.put("mobile_no", MOBILE);
            data.put("session_token", "token");
            data.put("jwt_token", "jwt");
            data.put("language_code", "en");
            data.put("language_name", "English");
            data.put("region_code", "us");

            assertThat(failureFor("set:language", data, SetLanguageRequest.class).field()).isEqualTo("region_code");
        }

        @Test
        void deviceInfoRequiresTimestamp() {
            ObjectNode data = objectMapper.createObjectNode();
            data.put("device_id", DEVICE_ID);
            data.put("device_type", "android");

            ValidationFailure failure = failureFor("device:info", data, DeviceInfoRequest.class);

            assertThat(failure.code()).isEqualTo(ValidationFailure.MISSING_FIELD);
            assertThat(failure.field()).isEqualTo("timestamp");
        }
    }
}
