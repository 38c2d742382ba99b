package com.mini.bloomdb.source;

import com.mini.bloomdb.fs.Storage;

import java.util.Locale;

/**
 * 根据文件扩展名选择数据源格式：.parquet 按 Parquet 读取，其余按 CSV 读取
 */
public final class TabularSourceFactory {

    public static final String PARQUET_EXTENSION = ".parquet";

    private TabularSourceFactory() {
    }

    public static TabularSource open(Storage storage, String location) {
        if (location.toLowerCase(Locale.ROOT).endsWith(PARQUET_EXTENSION)) {
            return ParquetTabularSource.open(storage, location);
        }
        return CsvTabularSource.open(storage, location);
    }
}
