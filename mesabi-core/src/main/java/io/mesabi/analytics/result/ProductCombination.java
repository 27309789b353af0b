package io.mesabi.analytics.result;

/** An unordered product pair seen in the same sale; {@code productIdA < productIdB} always holds. */
public record ProductCombination(long productIdA,
                                 long productIdB,
                                 long timesTogether,
                                 double totalRevenue,
                                 double averageTicket) {
}
