package com.mini.bloomdb.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 列数据类型
 * 
 * 索引中只保存规范化后的值：整数统一为 Long，浮点数统一为 Double。
 * VARIANT 表示列中混合了多种基本类型，只能使用成员索引。
 */
public enum DataType {
    
    BIGINT {
        @Override
        public boolean isCompatible(Object value) {
            return value instanceof Long;
        }
        
        @Override
        public boolean accepts(String text) {
            return INTEGRAL.matcher(text).matches() && parseLongOrNull(text) != null;
        }
        
        @Override
        public Object parse(String text) {
            return Long.parseLong(text.trim());
        }
        
        @Override
        public Optional<Object> coerce(Object target) {
            Object value = normalize(target);
            if (value instanceof Long) {
                return Optional.of(value);
            }
            if (value instanceof Double) {
                double d = (Double) value;
                if (d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63) {
                    return Optional.of((long) d);
                }
                return Optional.empty();
            }
            if (value instanceof String) {
                String text = ((String) value).trim();
                Long parsed = parseLongOrNull(text);
                if (parsed != null) {
                    return Optional.of(parsed);
                }
                if (DECIMAL.matcher(text).matches()) {
                    return coerce(Double.parseDouble(text));
                }
            }
            return Optional.empty();
        }
    },
    
    DOUBLE {
        @Override
        public boolean isCompatible(Object value) {
            return value instanceof Double;
        }
        
        @Override
        public boolean accepts(String text) {
            return DECIMAL.matcher(text.trim()).matches();
        }
        
        @Override
        public Object parse(String text) {
            return normalize(Double.parseDouble(text.trim()));
        }
        
        @Override
        public Optional<Object> coerce(Object target) {
            Object value = normalize(target);
            if (value instanceof Long) {
                return Optional.of(normalize(((Long) value).doubleValue()));
            }
            if (value instanceof Double) {
                return Optional.of(value);
            }
            if (value instanceof String && accepts((String) value)) {
                return Optional.of(parse((String) value));
            }
            return Optional.empty();
        }
    },
    
    BOOLEAN {
        @Override
        public boolean isCompatible(Object value) {
            return value instanceof Boolean;
        }
        
        @Override
        public boolean accepts(String text) {
            String t = text.trim();
            return "true".equalsIgnoreCase(t) || "false".equalsIgnoreCase(t);
        }
        
        @Override
        public Object parse(String text) {
            return Boolean.parseBoolean(text.trim());
        }
        
        @Override
        public Optional<Object> coerce(Object target) {
            Object value = normalize(target);
            if (value instanceof Boolean) {
                return Optional.of(value);
            }
            if (value instanceof String && accepts((String) value)) {
                return Optional.of(parse((String) value));
            }
            return Optional.empty();
        }
    },
    
    STRING {
        @Override
        public boolean isCompatible(Object value) {
            return value instanceof String;
        }
        
        @Override
        public boolean accepts(String text) {
            return true;
        }
        
        @Override
        public Object parse(String text) {
            return text;
        }
        
        @Override
        public Optional<Object> coerce(Object target) {
            Object value = normalize(target);
            return value == null ? Optional.empty() : Optional.of(value.toString());
        }
    },
    
    VARIANT {
        @Override
        public boolean isCompatible(Object value) {
            return value instanceof Long || value instanceof Double 
                    || value instanceof Boolean || value instanceof String;
        }
        
        @Override
        public boolean isComparable() {
            return false;
        }
        
        @Override
        public boolean accepts(String text) {
            return true;
        }
        
        @Override
        public Object parse(String text) {
            return text;
        }
        
        @Override
        public Optional<Object> coerce(Object target) {
            return Optional.ofNullable(normalize(target));
        }
    };
    
    private static final Pattern INTEGRAL = Pattern.compile("\\s*[+-]?\\d+\\s*");
    
    private static final Pattern DECIMAL = 
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    
    /**
     * 判断规范化后的值是否属于该类型
     */
    public abstract boolean isCompatible(Object value);
    
    /**
     * 判断 CSV 文本能否解析为该类型，用于类型推断
     */
    public abstract boolean accepts(String text);
    
    /**
     * 将 CSV 文本解析为该类型的规范值
     */
    public abstract Object parse(String text);
    
    /**
     * 将查询值转换为该类型的规范值
     * @return 无法转换时返回 empty，表示该值不可能出现在这一列中
     */
    public abstract Optional<Object> coerce(Object target);
    
    /**
     * 该类型的值是否有自然顺序（能否使用范围索引）
     */
    public boolean isComparable() {
        return true;
    }
    
    /**
     * 规范化单个值
     * @return 规范值；value 为 null 时返回 null
     * @throws IllegalArgumentException 不支持的 Java 类型
     */
    public static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Long || value instanceof Integer 
                || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            // -0.0 与 0.0 视为同一个值
            return d == 0.0d ? 0.0d : d;
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            return big.bitLength() < 64 ? (Object) big.longValue() : (Object) big.doubleValue();
        }
        if (value instanceof BigDecimal) {
            BigDecimal big = (BigDecimal) value;
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                return normalize(big.doubleValue());
            }
        }
        if (value instanceof Character) {
            return value.toString();
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }
    
    /**
     * 推断规范值的类型
     */
    public static DataType typeOf(Object normalized) {
        if (normalized instanceof Long) {
            return BIGINT;
        } else if (normalized instanceof Double) {
            return DOUBLE;
        } else if (normalized instanceof Boolean) {
            return BOOLEAN;
        } else if (normalized instanceof String) {
            return STRING;
        }
        throw new IllegalArgumentException("Not a normalized value: " + normalized);
    }
    
    /**
     * 根据名称获取类型（忽略大小写）
     */
    public static DataType fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown data type: " + name, e);
        }
    }
    
    private static Long parseLongOrNull(String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
