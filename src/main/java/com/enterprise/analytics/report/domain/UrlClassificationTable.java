package com.enterprise.analytics.report.domain;

import com.enterprise.analytics.sql.core.Column;
import com.enterprise.analytics.sql.core.Table;

public final class UrlClassificationTable extends Table {

    public static final UrlClassificationTable URL_CLASSIFICATIONS = new UrlClassificationTable("uc");

    public final Column<String>  URL_PATH;
    public final Column<Long>    PRODUCT_ID;
    public final Column<String>  COUNTRY_CODE;
    public final Column<Boolean> IS_IGNORED;

    public UrlClassificationTable(String alias) {
        super("app_url_classifications", alias);
        this.URL_PATH     = column("url_path", String.class);
        this.PRODUCT_ID   = column("product_id", Long.class);
        this.COUNTRY_CODE = column("country_code", String.class);
        this.IS_IGNORED   = column("is_ignored", Boolean.class);
    }

    @Override
    public UrlClassificationTable as(String newAlias) {
        return new UrlClassificationTable(newAlias);
    }
}
