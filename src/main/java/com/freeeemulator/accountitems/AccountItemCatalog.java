package com.freeeemulator.accountitems;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Seeded chart of accounts shared by every company.
 */
@Component
public class AccountItemCatalog {

    private static final int TAX_CODE_NONE = 0;
    private static final int TAX_CODE_TAXABLE_SALES = 21;
    private static final int TAX_CODE_TAXABLE_PURCHASES = 136;

    private final List<AccountItem> accountItems = List.of(
        new AccountItem(101, "現金", "asset", TAX_CODE_NONE),
        new AccountItem(102, "普通預金", "asset", TAX_CODE_NONE),
        new AccountItem(103, "売掛金", "asset", TAX_CODE_NONE),

        new AccountItem(201, "買掛金", "liability", TAX_CODE_NONE),
        new AccountItem(202, "未払金", "liability", TAX_CODE_NONE),
        new AccountItem(203, "クレジットカード", "liability", TAX_CODE_NONE),

        new AccountItem(401, "売上高", "income", TAX_CODE_TAXABLE_SALES),

        new AccountItem(501, "仕入高", "expense", TAX_CODE_TAXABLE_PURCHASES),
        new AccountItem(502, "新聞図書費", "expense", TAX_CODE_TAXABLE_PURCHASES),
        new AccountItem(503, "研修費", "expense", TAX_CODE_TAXABLE_PURCHASES),
        new AccountItem(504, "消耗品費", "expense", TAX_CODE_TAXABLE_PURCHASES),
        new AccountItem(505, "通信費", "expense", TAX_CODE_TAXABLE_PURCHASES),
        new AccountItem(506, "支払手数料", "expense", TAX_CODE_TAXABLE_PURCHASES),
        new AccountItem(507, "旅費交通費", "expense", TAX_CODE_TAXABLE_PURCHASES),
        new AccountItem(508, "接待交際費", "expense", TAX_CODE_TAXABLE_PURCHASES),
        new AccountItem(509, "雑費", "expense", TAX_CODE_TAXABLE_PURCHASES),
        new AccountItem(510, "広告宣伝費", "expense", TAX_CODE_TAXABLE_PURCHASES),
        new AccountItem(511, "地代家賃", "expense", TAX_CODE_TAXABLE_PURCHASES),
        new AccountItem(512, "水道光熱費", "expense", TAX_CODE_TAXABLE_PURCHASES),
        new AccountItem(513, "保険料", "expense", TAX_CODE_TAXABLE_PURCHASES),
        new AccountItem(514, "研究開発費", "expense", TAX_CODE_TAXABLE_PURCHASES)
    );

    public List<AccountItem> findAll() {
        return accountItems;
    }

    public Optional<AccountItem> find(long id) {
        return accountItems.stream()
            .filter(item -> item.getId() == id)
            .findFirst();
    }

    /**
     * Display name for an account item id, or null if the id is not in the chart.
     */
    public String nameOf(long id) {
        return find(id).map(AccountItem::getName).orElse(null);
    }
}
