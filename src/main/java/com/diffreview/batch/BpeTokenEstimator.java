package com.diffreview.batch;

import java.util.Locale;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

public class BpeTokenEstimator implements TokenEstimator {
    private static final EncodingRegistry REGISTRY = Encodings.newLazyEncodingRegistry();

    private final EncodingType encodingType;
    private final Encoding encoding;

    public BpeTokenEstimator() {
        this(EncodingType.R50K_BASE);
    }

    public BpeTokenEstimator(EncodingType encodingType) {
        this.encodingType = encodingType;
        this.encoding = REGISTRY.getEncoding(encodingType);
    }

    public static BpeTokenEstimator forEncoding(String name) {
        if (name == null || name.isBlank()) {
            return new BpeTokenEstimator();
        }
        return new BpeTokenEstimator(typeOf(name.trim().toLowerCase(Locale.ROOT)));
    }

    @Override
    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokens(text);
    }

    @Override
    public String name() {
        return "bpe-" + encodingType.getName();
    }

    private static EncodingType typeOf(String name) {
        for (EncodingType type : EncodingType.values()) {
            if (type.getName().equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown token encoding: " + name);
    }
}
