package com.bbthechange.mobilelogin.service;

import com.bbthechange.mobilelogin.dto.LoginRequest;
import com.bbthechange.mobilelogin.dto.LoginSuccessResponse;
import com.bbthechange.mobilelogin.dto.OtpVerifiedResponse;
import com.bbthechange.mobilelogin.dto.RefreshTokenRequest;
import com.bbthechange.mobilelogin.dto.TokenRefreshedResponse;
import com.bbthechange.mobilelogin.dto.VerifyOtpRequest;
import com.bbthechange.mobilelogin.exception.InvalidTokenException;
import com.bbthechange.mobilelogin.exception.LoginThrottledException;
import com.bbthechange.mobilelogin.exception.UnauthorizedException;
import com.bbthechange.mobilelogin.model.IssuedCredential;
import com.bbthechange.mobilelogin.model.LoginChallenge;
import com.bbthechange.mobilelogin.model.RegisteredUser;
import com.bbthechange.mobilelogin.model.User;
import com.bbthechange.mobilelogin.util.SecureTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * The login and OTP verification flows.
 * <p>
 * A user record is created only once an OTP has been verified; {@code login} just reports
 * whether the number is already known.
 */
@Service
public class LoginService {

    private static final Logger logger = LoggerFactory.getLogger(LoginService.class);

    static final String TOKEN_TYPE = "Bearer";
    static final String NEW_USER = "new_user";
    static final String EXISTING_USER = "existing_user";

    private final UserDirectoryService userDirectory;
    private final SessionLedgerService sessionLedger;
    private final OtpVerificationService otpVerifier;
    private final JwtService jwtService;
    private final RateLimitingService rateLimitingService;

    public LoginService(UserDirectoryService userDirectory,
                        SessionLedgerService sessionLedger,
                        OtpVerificationService otpVerifier,
                        JwtService jwtService,
                        RateLimitingService rateLimitingService) {
        this.userDirectory = userDirectory;
        this.sessionLedger = sessionLedger;
        this.otpVerifier = otpVerifier;
        this.jwtService = jwtService;
        this.rateLimitingService = rateLimitingService;
    }

    /**
     * Issue a new OTP challenge for the number.
     *
     * @throws LoginThrottledException if the number asked for too many OTPs this hour
     */
    public LoginSuccessResponse login(LoginRequest request) {
        String mobileNo = request.getMobileNo();
        if (!rateLimitingService.isLoginAllowed(mobileNo)) {
            throw new LoginThrottledException(mobileNo);
        }

        boolean newUser = !userDirectory.exists(mobileNo);
        String otp = SecureTokens.generateSixDigitCode();
        LoginChallenge challenge = sessionLedger.issue(mobileNo, request.getDeviceId(), request.getFcmToken(),
                request.getEmail(), otp);

        return LoginSuccessResponse.builder()
                .mobileNo(mobileNo)
                .deviceId(request.getDeviceId())
                .sessionToken(challenge.getSessionToken())
                .otp(otp)
                .newUser(newUser)
                .expiresAt(challenge.getExpiresAt())
                .build();
    }

    /**
     * Check the OTP and, when it matches, register or update the user and issue a credential.
     */
    public VerifyOtpOutcome verifyOtp(VerifyOtpRequest request) {
        VerificationResult result = otpVerifier.verify(request.getMobileNo(), request.getSessionToken(), request.getOtp());
        if (!result.isVerified()) {
            return new VerifyOtpOutcome(result, null);
        }

        LoginChallenge challenge = result.getChallenge();
        String mobileNo = challenge.getMobileNumber();

        User user;
        boolean newUser;
        Optional<User> existing = userDirectory.find(mobileNo);
        if (existing.isPresent()) {
            user = existing.get();
            newUser = false;
            userDirectory.refreshDevice(user, challenge.getDeviceId(), challenge.getFcmToken());
        } else {
            RegisteredUser registered = userDirectory.register(mobileNo, challenge.getDeviceId(),
                    challenge.getFcmToken(), challenge.getEmail());
            user = registered.user();
            newUser = registered.newUser();
        }
        userDirectory.recordLogin(mobileNo);

        IssuedCredential credential = jwtService.mint(user.getUserId(), user.getUserNumber(), mobileNo,
                challenge.getDeviceId(), challenge.getFcmToken());
        sessionLedger.markVerified(challenge, credential.tokenId());
        logger.info("User {} logged in ({})", user.getUserId(), newUser ? NEW_USER : EXISTING_USER);

        OtpVerifiedResponse response = OtpVerifiedResponse.builder()
                .mobileNo(mobileNo)
                .sessionToken(challenge.getSessionToken())
                .userId(user.getUserId())
                .userNumber(user.getUserNumber())
                .userStatus(newUser ? NEW_USER : EXISTING_USER)
                .jwtToken(credential.token())
                .tokenType(TOKEN_TYPE)
                .expiresIn(jwtService.getCredentialLifetimeSeconds())
                .build();
        return new VerifyOtpOutcome(result, response);
    }

    /**
     * Exchange a still valid credential for a fresh one.
     *
     * @throws UnauthorizedException if the presented credential does not verify
     */
    public TokenRefreshedResponse refresh(RefreshTokenRequest request) {
        IssuedCredential credential;
        try {
            credential = jwtService.refresh(request.getJwtToken());
        } catch (InvalidTokenException e) {
            throw new UnauthorizedException(e.getMessage());
        }
        return TokenRefreshedResponse.builder()
                .jwtToken(credential.token())
                .tokenType(TOKEN_TYPE)
                .expiresIn(jwtService.getCredentialLifetimeSeconds())
                .build();
    }
}
