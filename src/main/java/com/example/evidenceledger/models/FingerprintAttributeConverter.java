package com.example.evidenceledger.models;

import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

public class FingerprintAttributeConverter implements AttributeConverter<Fingerprint> {

    @Override
    public AttributeValue transformFrom(Fingerprint input) {
        if (input == null) {
            return AttributeValue.builder().nul(true).build();
        }
        return AttributeValue.builder().s(input.toHex()).build();
    }

    @Override
    public Fingerprint transformTo(AttributeValue attributeValue) {
        if (attributeValue == null || Boolean.TRUE.equals(attributeValue.nul())) {
            return null;
        }
        String raw = attributeValue.s();
        if (raw == null) {
            return null;
        }
        return Fingerprint.fromHex(raw);
    }

    @Override
    public EnhancedType<Fingerprint> type() {
        return EnhancedType.of(Fingerprint.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.S; // 0x-prefixed lowercase hex
    }
}
