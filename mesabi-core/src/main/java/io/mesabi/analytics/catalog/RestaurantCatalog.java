package io.mesabi.analytics.catalog;

import io.mesabi.analytics.query.Subject;

import java.util.List;

import static io.mesabi.analytics.catalog.ColumnType.*;

/** The restaurant sales schema: sales, product lines, item customizations, deliveries and customers. */
public final class RestaurantCatalog {
  private RestaurantCatalog() {}

  public static SchemaCatalog defaults() {
    return new InMemorySchemaCatalog(List.of(sales(), deliveries(), products(), customers(), items()));
  }

  static SubjectSchema sales() {
    return SubjectSchema.builder(Subject.SALES, "sales")
        .columns(INTEGER, "id", "store_id", "sub_brand_id", "customer_id", "channel_id",
            "production_seconds", "delivery_seconds", "people_quantity")
        .columns(TEXT, "cod_sale1", "cod_sale2", "customer_name", "sale_status_desc",
            "discount_reason", "increase_reason", "origin")
        .columns(DECIMAL, "total_amount_items", "total_discount", "total_increase", "delivery_fee",
            "service_tax_fee", "total_amount", "value_paid")
        .columns(TIMESTAMP, "created_at")
        // delivery destination region
        .joinedColumns("da", TEXT, "city", "state", "neighborhood", "postal_code")
        .temporal("created_at")
        .temporalDerivations()
        .join("st", "stores", "sales.store_id = st.id")
        .join("da", "delivery_addresses", "sales.id = da.sale_id")
        .join("ch", "channels", "sales.channel_id = ch.id")
        .join("c", "customers", "sales.customer_id = c.id")
        .display("store_id", "st.name", "store_name", "st", "st.name")
        // channels repeat descriptions across brands, so the id stays in the grouping
        .display("channel_id", "ch.description", "channel_name", "ch", "ch.description", "ch.id")
        .display("customer_id", "c.customer_name", "customer_name", "c", "c.customer_name")
        .build();
  }

  static SubjectSchema deliveries() {
    return SubjectSchema.builder(Subject.DELIVERIES, "delivery_sales")
        .columns(INTEGER, "id", "sale_id")
        .columns(TEXT, "courier_id", "courier_name", "courier_phone", "courier_type", "delivered_by",
            "delivery_type", "status", "mode")
        .columns(DECIMAL, "delivery_fee", "courier_fee")
        .joinedColumns("s", INTEGER, "store_id", "channel_id", "production_seconds", "delivery_seconds")
        .joinedColumns("s", DECIMAL, "total_amount")
        .joinedColumns("s", TEXT, "sale_status_desc")
        .joinedColumns("s", TIMESTAMP, "created_at")
        .joinedColumns("da", TEXT, "city", "state", "neighborhood", "postal_code")
        .temporal("created_at")
        .temporalDerivations()
        .join("s", "sales", "delivery_sales.sale_id = s.id")
        .join("da", "delivery_addresses", "delivery_sales.sale_id = da.sale_id")
        .build();
  }

  static SubjectSchema products() {
    return SubjectSchema.builder(Subject.PRODUCTS, "product_sales")
        .columns(INTEGER, "id", "sale_id", "product_id")
        .columns(DECIMAL, "quantity", "base_price", "total_price")
        .columns(TEXT, "observations")
        .joinedColumns("p", INTEGER, "category_id")
        .joinedColumns("s", INTEGER, "store_id", "channel_id")
        .joinedColumns("s", DECIMAL, "total_amount")
        .joinedColumns("s", TEXT, "sale_status_desc")
        .joinedColumns("s", TIMESTAMP, "created_at")
        .temporal("created_at")
        .temporalDerivations()
        .join("p", "products", "product_sales.product_id = p.id")
        .join("s", "sales", "product_sales.sale_id = s.id")
        .display("product_id", "p.name", "product_name", "p", "p.name")
        .build();
  }

  static SubjectSchema customers() {
    return SubjectSchema.builder(Subject.CUSTOMERS, "customers")
        .columns(INTEGER, "id", "store_id", "sub_brand_id")
        .columns(TEXT, "customer_name", "email", "phone_number", "gender", "registration_origin")
        .columns(BOOLEAN, "agree_terms", "receive_promotions_email", "receive_promotions_sms")
        .columns(DATE, "birth_date")
        .columns(TIMESTAMP, "created_at")
        .temporal("created_at")
        .temporalDerivations()
        .build();
  }

  static SubjectSchema items() {
    return SubjectSchema.builder(Subject.ITEMS, "item_product_sales")
        .columns(INTEGER, "id", "product_sale_id", "item_id", "option_group_id")
        .columns(DECIMAL, "quantity", "additional_price", "price", "amount")
        .columns(TEXT, "observations")
        .joinedColumns("ps", INTEGER, "product_id", "sale_id")
        .joinedColumns("s", INTEGER, "store_id", "channel_id")
        .joinedColumns("s", DECIMAL, "total_amount")
        .joinedColumns("s", TEXT, "sale_status_desc")
        .joinedColumns("s", TIMESTAMP, "created_at")
        .temporal("created_at")
        .temporalDerivations()
        // items carry no time or channel of their own: always reach the sale through the product line
        .join(new JoinDef("ps", "product_sales", "item_product_sales.product_sale_id = ps.id", null, true))
        .join(new JoinDef("s", "sales", "ps.sale_id = s.id", "ps", true))
        .join("i", "items", "item_product_sales.item_id = i.id")
        .join(new JoinDef("p", "products", "ps.product_id = p.id", "ps", false))
        .display("item_id", "i.name", "item_name", "i", "i.name")
        .display("product_id", "p.name", "product_name", "p", "p.name")
        .build();
  }
}
