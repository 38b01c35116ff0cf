package io.tradeload.trading;

import io.tradeload.registry.ArithmeticRule;
import io.tradeload.registry.ColumnDescriptor;
import io.tradeload.registry.EntityDescriptor;
import io.tradeload.registry.EntityRegistry;

/**
 * Descriptors of the account and transaction entities. Accounts load first; every transaction must
 * reference a loaded account.
 */
public final class TradingEntities {
    public static final String ACCOUNT = "account";
    public static final String TRANSACTION = "transaction";
    public static final String TIMESTAMP_FORMAT = "yyyy-MM-dd'T'HH:mm:ss";

    private static final int MONEY_PRECISION = 20;
    private static final int MONEY_SCALE = 2;

    private TradingEntities() {}

    public static EntityDescriptor account() {
        return EntityDescriptor.builder(ACCOUNT)
                .table("account")
                .conflictKey("account_id")
                .column(ColumnDescriptor.string("account_id").maxLength(20))
                .column(ColumnDescriptor.int32("account_type").oneOf(AccountType.codes()))
                .column(money("cash"))
                .column(money("frozen_cash"))
                .column(money("market_value"))
                .column(money("total_asset"))
                .column(ColumnDescriptor.timestamp("updated_at", TIMESTAMP_FORMAT))
                .rule(ArithmeticRule.sum("total_asset", "cash", "frozen_cash", "market_value"))
                .build();
    }

    public static EntityDescriptor transaction() {
        return EntityDescriptor.builder(TRANSACTION)
                .table("trade")
                .conflictKey("traded_id")
                .parent(ACCOUNT, "account_id", "account_id")
                .column(ColumnDescriptor.string("account_id").maxLength(20))
                .column(ColumnDescriptor.int32("account_type").oneOf(AccountType.codes()))
                .column(ColumnDescriptor.string("traded_id").maxLength(50))
                .column(ColumnDescriptor.string("stock_code").maxLength(10))
                .column(ColumnDescriptor.timestamp("traded_time", TIMESTAMP_FORMAT))
                .column(money("traded_price"))
                .column(ColumnDescriptor.int32("traded_volume").quantity())
                .column(money("traded_amount"))
                .column(ColumnDescriptor.string("strategy_name").maxLength(50))
                .column(ColumnDescriptor.string("order_remark").maxLength(100).nullable())
                .column(ColumnDescriptor.int32("direction").oneOf(Direction.codes()))
                .column(ColumnDescriptor.int32("offset_flag").oneOf(OffsetFlag.codes()))
                .column(ColumnDescriptor.timestamp("created_at", TIMESTAMP_FORMAT))
                .column(ColumnDescriptor.timestamp("updated_at", TIMESTAMP_FORMAT))
                .rule(ArithmeticRule.product("traded_amount", "traded_price", "traded_volume"))
                .build();
    }

    /** Fresh registry holding both entities, in load order. */
    public static EntityRegistry registry() {
        return new EntityRegistry().register(account()).register(transaction());
    }

    private static ColumnDescriptor.Builder money(String name) {
        return ColumnDescriptor.decimal(name, MONEY_PRECISION, MONEY_SCALE).monetary();
    }
}
