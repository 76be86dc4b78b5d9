package com.enterprise.analytics.sql.core;

public final class Dialects {

    private Dialects() {}

    public static final SqlDialect ANSI = new SqlDialect() {
        @Override public String limit(int count) {
            return "FETCH FIRST " + count + " ROWS ONLY";
        }
        @Override public String offset(int skip) {
            return "OFFSET " + skip + " ROWS";
        }
        @Override public String limitOffset(int count, int skip) {
            return "OFFSET " + skip + " ROWS FETCH NEXT " + count + " ROWS ONLY";
        }
    };

    /** LIMIT/OFFSET form shared by PostgreSQL (analytics store) and MariaDB (CRM store). */
    public static final SqlDialect LIMIT_OFFSET = new SqlDialect() {
        @Override public String limit(int count) {
            return "LIMIT " + count;
        }
        @Override public String offset(int skip) {
            return "OFFSET " + skip;
        }
        @Override public String limitOffset(int count, int skip) {
            return "LIMIT " + count + " OFFSET " + skip;
        }
    };

    public static final SqlDialect POSTGRES = LIMIT_OFFSET;

    public static final SqlDialect MARIADB = LIMIT_OFFSET;
}
