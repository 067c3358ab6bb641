package com.relay.ai.pricing;

import com.relay.common.dto.AnalysisResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 按 token 用量估算调用费用（美元）。
 * <p>
 * 价格单位为每百万 token。模型名按最长前缀匹配，带日期后缀的版本号（如 claude-sonnet-4-20250514）
 * 会落到对应的模型族；没有价格配置的模型按 0 计费，不做猜测。
 */
@Slf4j
@Component
public class CostCalculator {

    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000);

    /** 结果保留的小数位数 */
    private static final int SCALE = 6;

    static final Price UNKNOWN_MODEL_PRICE = new Price("0", "0");

    private final Map<String, Price> pricing;

    public CostCalculator() {
        this(defaultPricing());
    }

    public CostCalculator(Map<String, Price> pricing) {
        this.pricing = new LinkedHashMap<>(pricing);
    }

    /**
     * 估算一次调用的费用。
     */
    public BigDecimal estimate(AnalysisResult result) {
        return estimate(result.getModel(), result.getInputTokens(), result.getOutputTokens());
    }

    public BigDecimal estimate(String model, long inputTokens, long outputTokens) {
        Price price = priceOf(model);
        BigDecimal input = price.input.multiply(BigDecimal.valueOf(Math.max(0, inputTokens)));
        BigDecimal output = price.output.multiply(BigDecimal.valueOf(Math.max(0, outputTokens)));
        return input.add(output).divide(ONE_MILLION, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 查找模型价格，找不到时返回零价格。
     */
    public Price priceOf(String model) {
        if (model == null || model.isBlank()) {
            return UNKNOWN_MODEL_PRICE;
        }
        String normalized = model.toLowerCase();
        return pricing.entrySet().stream()
                .filter(e -> normalized.startsWith(e.getKey()))
                .max(Comparator.comparingInt(e -> e.getKey().length()))
                .map(Map.Entry::getValue)
                .orElseGet(() -> {
                    log.debug("模型 {} 没有价格配置，费用按 0 计", model);
                    return UNKNOWN_MODEL_PRICE;
                });
    }

    private static Map<String, Price> defaultPricing() {
        Map<String, Price> prices = new LinkedHashMap<>();
        // Anthropic
        prices.put("claude-sonnet-4", new Price("3.00", "15.00"));
        prices.put("claude-3-5-sonnet", new Price("3.00", "15.00"));
        prices.put("claude-3-5-haiku", new Price("1.00", "5.00"));
        prices.put("claude-3-opus", new Price("15.00", "75.00"));
        // OpenAI
        prices.put("gpt-4o", new Price("2.50", "10.00"));
        prices.put("gpt-4o-mini", new Price("0.15", "0.60"));
        prices.put("gpt-4-turbo", new Price("10.00", "30.00"));
        // Google
        prices.put("gemini-1.5-pro", new Price("1.25", "5.00"));
        prices.put("gemini-1.5-flash", new Price("0.075", "0.30"));
        prices.put("gemini-2.0-flash", new Price("0.10", "0.40"));
        return prices;
    }

    /**
     * 每百万 token 的输入 / 输出价格。
     */
    public static final class Price {
        private final BigDecimal input;
        private final BigDecimal output;

        public Price(String input, String output) {
            this(new BigDecimal(input), new BigDecimal(output));
        }

        public Price(BigDecimal input, BigDecimal output) {
            this.input = input;
            this.output = output;
        }

        public BigDecimal getInput() {
            return input;
        }

        public BigDecimal getOutput() {
            return output;
        }
    }
}
