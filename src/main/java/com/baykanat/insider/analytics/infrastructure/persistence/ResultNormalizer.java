package com.baykanat.insider.analytics.infrastructure.persistence;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ClickHouse satırlarındaki sayısal görünen hücreleri sayıya çevirir.
 *
 * <p>Sütun adına bakılmaz: boş olmayan ve tamamen sonlu bir sayı olarak okunabilen her hücre
 * {@link Long} (tam sayı, 64 bite sığıyorsa) veya {@link Double} olur. Rakamlardan oluşan bir
 * etiket de dönüştürülür; istemciler bu davranışa güveniyor.
 */
@Component
public class ResultNormalizer {

    public List<Map<String, Object>> normalize(List<Map<String, Object>> rows) {
        List<Map<String, Object>> normalized = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            normalized.add(normalizeRow(row));
        }
        return normalized;
    }

    public Map<String, Object> normalizeRow(Map<String, Object> row) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        row.forEach((column, value) -> normalized.put(column, normalizeValue(value)));
        return normalized;
    }

    public Object normalizeValue(Object value) {
        if (value instanceof String text) {
            return parseNumber(text);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof Double || value instanceof Float) {
            return value;
        }
        if (value instanceof BigInteger bigInteger) {
            return fromBigDecimal(new BigDecimal(bigInteger), true);
        }
        if (value instanceof BigDecimal bigDecimal) {
            return fromBigDecimal(bigDecimal, bigDecimal.scale() <= 0);
        }
        if (value instanceof Number number) {
            // sürücüye özgü işaretsiz tipler (UInt64 vb.)
            return parseNumber(number.toString());
        }
        return value;
    }

    private Object parseNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return text;
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            return text;
        }
        boolean integral = trimmed.indexOf('.') < 0 && trimmed.indexOf('e') < 0 && trimmed.indexOf('E') < 0;
        return fromBigDecimal(parsed, integral);
    }

    private Object fromBigDecimal(BigDecimal value, boolean integral) {
        if (integral) {
            try {
                return value.longValueExact();
            } catch (ArithmeticException e) {
                // long'a sığmıyor, double'a düşer
            }
        }
        double asDouble = value.doubleValue();
        return Double.isFinite(asDouble) ? asDouble : value.toString();
    }
}
