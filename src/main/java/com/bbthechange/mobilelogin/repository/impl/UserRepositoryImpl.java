package com.bbthechange.mobilelogin.repository.impl;

import com.bbthechange.mobilelogin.exception.ReferralCodeTakenException;
import com.bbthechange.mobilelogin.exception.RepositoryException;
import com.bbthechange.mobilelogin.model.LocaleUpdate;
import com.bbthechange.mobilelogin.model.ProfileUpdate;
import com.bbthechange.mobilelogin.model.ReferralCodeClaim;
import com.bbthechange.mobilelogin.model.RegistrationOutcome;
import com.bbthechange.mobilelogin.model.User;
import com.bbthechange.mobilelogin.repository.UserRepository;
import com.bbthechange.mobilelogin.util.InstantAsLongAttributeConverter;
import com.bbthechange.mobilelogin.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.Delete;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.Update;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * User directory on the {@code Users} table. Every write after the initial insert is an
 * update that touches only the attributes it names, so concurrent partial updates of
 * different attributes do not overwrite each other.
 * <p>
 * Two writes span tables and run as one TransactWriteItems: registration advances the
 * {@code Counters} row together with the user put, and setting a referral code claims it in
 * {@code ReferralCodes} together with the user update.
 */
@Repository
public class UserRepositoryImpl implements UserRepository {

    private static final Logger logger = LoggerFactory.getLogger(UserRepositoryImpl.class);
    public static final String TABLE_NAME = "Users";
    public static final String REFERRAL_CODES_TABLE = "ReferralCodes";

    private static final String MOBILE_NUMBER = "mobileNumber";
    private static final String USER_EXISTS = "attribute_exists(mobileNumber)";
    private static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";
    private static final String TRANSACTION_CONFLICT = "TransactionConflict";

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<User> userSchema;
    private final TableSchema<ReferralCodeClaim> claimSchema;
    private final QueryPerformanceTracker queryTracker;

    public UserRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.userSchema = TableSchema.fromBean(User.class);
        this.claimSchema = TableSchema.fromBean(ReferralCodeClaim.class);
    }

    @Override
    public Optional<User> findByMobileNumber(String mobileNumber) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(keyFor(mobileNumber))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(userSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find user {}", mobileNumber, e);
                throw new RepositoryException("Failed to find user", e);
            }
        });
    }

    @Override
    public RegistrationOutcome insertNumbered(User user, String counterName, long expectedCounterValue) {
        Map<String, AttributeValue> counterValues = new HashMap<>();
        counterValues.put(":next", number(user.getUserNumber()));
        String counterCondition;
        if (expectedCounterValue == 0) {
            counterCondition = "attribute_not_exists(#value)";
        } else {
            counterCondition = "#value = :expected";
            counterValues.put(":expected", number(expectedCounterValue));
        }

        List<TransactWriteItem> transactItems = List.of(
            // 1. Claim the mobile number
            TransactWriteItem.builder()
                .put(Put.builder()
                    .tableName(TABLE_NAME)
                    .item(userSchema.itemToMap(user, true))
                    .conditionExpression("attribute_not_exists(mobileNumber)")
                    .build())
                .build(),
            // 2. Advance the counter only if nobody else moved it since it was read
            TransactWriteItem.builder()
                .update(Update.builder()
                    .tableName(SequenceCounterRepositoryImpl.TABLE_NAME)
                    .key(SequenceCounterRepositoryImpl.keyFor(counterName))
                    .updateExpression("SET #value = :next")
                    .conditionExpression(counterCondition)
                    .expressionAttributeNames(Map.of("#value", SequenceCounterRepositoryImpl.VALUE))
                    .expressionAttributeValues(counterValues)
                    .build())
                .build());

        return queryTracker.trackQuery("TransactWriteItems", TABLE_NAME, () -> {
            try {
                dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                    .transactItems(transactItems)
                    .build());
                logger.info("Registered user {} with number {}", user.getUserId(), user.getUserNumber());
                return RegistrationOutcome.INSERTED;

            } catch (TransactionCanceledException e) {
                List<CancellationReason> reasons = e.cancellationReasons();
                if (failedWith(reasons, 0, CONDITIONAL_CHECK_FAILED)) {
                    logger.info("User for mobile {} already registered, keeping existing record", user.getMobileNumber());
                    return RegistrationOutcome.MOBILE_TAKEN;
                }
                if (failedWith(reasons, 1, CONDITIONAL_CHECK_FAILED) || anyFailedWith(reasons, TRANSACTION_CONFLICT)) {
                    logger.debug("Counter {} moved past {}, registration of {} will retry",
                            counterName, expectedCounterValue, user.getMobileNumber());
                    return RegistrationOutcome.NUMBER_TAKEN;
                }
                logger.error("Transaction cancelled while registering {}: {}", user.getMobileNumber(), reasons);
                throw new RepositoryException("Failed to register user - transaction cancelled", e);
            } catch (DynamoDbException e) {
                logger.error("Failed to register user {}", user.getMobileNumber(), e);
                throw new RepositoryException("Failed to register user", e);
            }
        });
    }

    @Override
    public void updateLoginStats(String mobileNumber, Instant loginAt) {
        queryTracker.trackCommand("UpdateItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(keyFor(mobileNumber))
                    .updateExpression("ADD totalLogins :one SET lastLoginAt = :now, active = :active, updatedAt = :now")
                    .conditionExpression(USER_EXISTS)
                    .expressionAttributeValues(Map.of(
                        ":one", AttributeValue.builder().n("1").build(),
                        ":now", InstantAsLongAttributeConverter.toAttributeValue(loginAt),
                        ":active", AttributeValue.builder().bool(true).build()
                    ))
                    .build());

            } catch (ConditionalCheckFailedException e) {
                logger.debug("No user {} to update login stats for", mobileNumber);
            } catch (DynamoDbException e) {
                logger.error("Failed to update login stats for {}", mobileNumber, e);
                throw new RepositoryException("Failed to update login stats", e);
            }
        });
    }

    @Override
    public void updateDeviceTokens(String mobileNumber, String deviceId, String fcmToken, Instant updatedAt) {
        Map<String, AttributeValue> fields = new LinkedHashMap<>();
        putIfPresent(fields, "deviceId", deviceId);
        putIfPresent(fields, "fcmToken", fcmToken);
        updateAttributes(mobileNumber, fields, updatedAt);
    }

    @Override
    public Optional<User> updateProfile(String mobileNumber, ProfileUpdate update, Instant updatedAt) {
        Map<String, AttributeValue> fields = new LinkedHashMap<>();
        putIfPresent(fields, "fullName", update.fullName());
        putIfPresent(fields, "state", update.state());
        putIfPresent(fields, "referralCode", update.referralCode());
        putIfPresent(fields, "referredBy", update.referredBy());
        putIfPresent(fields, "profileData", update.profileData());
        if (update.referralCode() == null) {
            return updateAttributes(mobileNumber, fields, updatedAt);
        }
        return updateClaimingReferralCode(mobileNumber, fields, update, updatedAt);
    }

    @Override
    public Optional<User> updateLocale(String mobileNumber, LocaleUpdate update, Instant updatedAt) {
        Map<String, AttributeValue> fields = new LinkedHashMap<>();
        putIfPresent(fields, "languageCode", update.languageCode());
        putIfPresent(fields, "languageName", update.languageName());
        putIfPresent(fields, "regionCode", update.regionCode());
        putIfPresent(fields, "timezone", update.timezone());
        putIfPresent(fields, "preferences", update.preferences());
        return updateAttributes(mobileNumber, fields, updatedAt);
    }

    @Override
    public Optional<String> findOwnerOfReferralCode(String referralCode) {
        return queryTracker.trackQuery("GetItem", REFERRAL_CODES_TABLE, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(REFERRAL_CODES_TABLE)
                    .key(claimKeyFor(referralCode))
                    .projectionExpression(MOBILE_NUMBER)
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.ofNullable(response.item().get(MOBILE_NUMBER)).map(AttributeValue::s);

            } catch (DynamoDbException e) {
                logger.error("Failed to look up referral code {}", referralCode, e);
                throw new RepositoryException("Failed to look up referral code", e);
            }
        });
    }

    private Optional<User> updateClaimingReferralCode(String mobileNumber, Map<String, AttributeValue> fields,
                                                      ProfileUpdate update, Instant updatedAt) {
        String code = update.referralCode();
        SetExpression set = setExpression(fields, updatedAt);
        AttributeValue owner = AttributeValue.builder().s(mobileNumber).build();

        List<TransactWriteItem> transactItems = new ArrayList<>();
        // 1. Claim the code, unless another user holds it
        transactItems.add(TransactWriteItem.builder()
            .put(Put.builder()
                .tableName(REFERRAL_CODES_TABLE)
                .item(claimSchema.itemToMap(new ReferralCodeClaim(code, mobileNumber, updatedAt), true))
                .conditionExpression("attribute_not_exists(referralCode) OR mobileNumber = :owner")
                .expressionAttributeValues(Map.of(":owner", owner))
                .build())
            .build());
        // 2. Release the code it replaces, never another user's claim
        String replaced = update.replacedReferralCode();
        if (replaced != null && !replaced.equals(code)) {
            transactItems.add(TransactWriteItem.builder()
                .delete(Delete.builder()
                    .tableName(REFERRAL_CODES_TABLE)
                    .key(claimKeyFor(replaced))
                    .conditionExpression("attribute_not_exists(referralCode) OR mobileNumber = :owner")
                    .expressionAttributeValues(Map.of(":owner", owner))
                    .build())
                .build());
        }
        // 3. Write the profile attributes
        transactItems.add(TransactWriteItem.builder()
            .update(Update.builder()
                .tableName(TABLE_NAME)
                .key(keyFor(mobileNumber))
                .updateExpression(set.expression())
                .conditionExpression(USER_EXISTS)
                .expressionAttributeNames(set.names())
                .expressionAttributeValues(set.values())
                .build())
            .build());
        int userIndex = transactItems.size() - 1;

        boolean written = queryTracker.trackQuery("TransactWriteItems", TABLE_NAME, () -> {
            try {
                dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                    .transactItems(transactItems)
                    .build());
                logger.debug("Updated {} attributes and claimed referral code for user {}", fields.keySet(), mobileNumber);
                return true;

            } catch (TransactionCanceledException e) {
                List<CancellationReason> reasons = e.cancellationReasons();
                if (failedWith(reasons, userIndex, CONDITIONAL_CHECK_FAILED)) {
                    return false;
                }
                if (failedWith(reasons, 0, CONDITIONAL_CHECK_FAILED) || failedWith(reasons, 0, TRANSACTION_CONFLICT)) {
                    throw new ReferralCodeTakenException(code);
                }
                logger.error("Transaction cancelled while updating profile of {}: {}", mobileNumber, reasons);
                throw new RepositoryException("Failed to update user - transaction cancelled", e);
            } catch (DynamoDbException e) {
                logger.error("Failed to update user {}", mobileNumber, e);
                throw new RepositoryException("Failed to update user", e);
            }
        });
        return written ? findByMobileNumber(mobileNumber) : Optional.empty();
    }

    private Optional<User> updateAttributes(String mobileNumber, Map<String, AttributeValue> fields, Instant updatedAt) {
        SetExpression set = setExpression(fields, updatedAt);

        return queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                UpdateItemResponse response = dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(keyFor(mobileNumber))
                    .updateExpression(set.expression())
                    .conditionExpression(USER_EXISTS)
                    .expressionAttributeNames(set.names())
                    .expressionAttributeValues(set.values())
                    .returnValues(ReturnValue.ALL_NEW)
                    .build());
                logger.debug("Updated {} attributes for user {}", fields.keySet(), mobileNumber);
                return Optional.of(userSchema.mapToItem(response.attributes()));

            } catch (ConditionalCheckFailedException e) {
                return Optional.empty();
            } catch (DynamoDbException e) {
                logger.error("Failed to update user {}", mobileNumber, e);
                throw new RepositoryException("Failed to update user", e);
            }
        });
    }

    private static SetExpression setExpression(Map<String, AttributeValue> fields, Instant updatedAt) {
        Map<String, String> names = new HashMap<>();
        Map<String, AttributeValue> values = new HashMap<>();
        StringJoiner set = new StringJoiner(", ", "SET ", "");

        int i = 0;
        for (Map.Entry<String, AttributeValue> field : fields.entrySet()) {
            names.put("#f" + i, field.getKey());
            values.put(":v" + i, field.getValue());
            set.add("#f" + i + " = :v" + i);
            i++;
        }
        names.put("#updatedAt", "updatedAt");
        values.put(":updatedAt", InstantAsLongAttributeConverter.toAttributeValue(updatedAt));
        set.add("#updatedAt = :updatedAt");
        return new SetExpression(set.toString(), names, values);
    }

    private record SetExpression(String expression, Map<String, String> names, Map<String, AttributeValue> values) {
    }

    private static boolean failedWith(List<CancellationReason> reasons, int index, String code) {
        return reasons.size() > index && code.equals(reasons.get(index).code());
    }

    private static boolean anyFailedWith(List<CancellationReason> reasons, String code) {
        return reasons.stream().anyMatch(reason -> code.equals(reason.code()));
    }

    private static AttributeValue number(long value) {
        return AttributeValue.builder().n(String.valueOf(value)).build();
    }

    private static void putIfPresent(Map<String, AttributeValue> fields, String name, String value) {
        if (value != null) {
            fields.put(name, AttributeValue.builder().s(value).build());
        }
    }

    private static Map<String, AttributeValue> keyFor(String mobileNumber) {
        return Map.of(MOBILE_NUMBER, AttributeValue.builder().s(mobileNumber).build());
    }

    private static Map<String, AttributeValue> claimKeyFor(String referralCode) {
        return Map.of("referralCode", AttributeValue.builder().s(referralCode).build());
    }
}
