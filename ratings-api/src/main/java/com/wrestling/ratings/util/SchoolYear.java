package com.wrestling.ratings.util;

import java.time.LocalDate;

/**
 * School years start in September: 2023-09-15 belongs to school year 2023,
 * 2024-03-01 also to 2023.
 */
public final class SchoolYear {

    private SchoolYear() {}

    public static int of(LocalDate date) {
        return date.getMonthValue() > 8 ? date.getYear() : date.getYear() - 1;
    }
}
