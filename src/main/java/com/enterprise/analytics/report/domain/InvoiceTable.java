package com.enterprise.analytics.report.domain;

import com.enterprise.analytics.sql.core.Column;
import com.enterprise.analytics.sql.core.Table;

public final class InvoiceTable extends Table {

    public static final InvoiceTable INVOICES = new InvoiceTable("i");

    public final Column<Long>    SUBSCRIPTION_ID;
    public final Column<Integer> TYPE;
    public final Column<String>  TAG;
    public final Column<Integer> IS_MARKED;
    public final Column<Integer> DELETED;

    public InvoiceTable(String alias) {
        super("invoice", alias);
        this.SUBSCRIPTION_ID = column("subscription_id", Long.class);
        this.TYPE            = column("type", Integer.class);
        this.TAG             = column("tag", String.class);
        this.IS_MARKED       = column("is_marked", Integer.class);
        this.DELETED         = column("deleted", Integer.class);
    }

    @Override
    public InvoiceTable as(String newAlias) {
        return new InvoiceTable(newAlias);
    }
}
