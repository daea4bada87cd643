package org.villecon.runtime;

/**
 * Fixed constants of the economy model that are not exposed as configuration.
 */
public final class Config {

    private Config() {}

    /** Maximum number of entries kept in a village's population history. */
    public static final int POPULATION_HISTORY_SIZE = 10;

    /** Number of history entries considered when deriving a population trend. */
    public static final int TREND_WINDOW = 3;

    /** Maximum number of buildings under construction at the same time. */
    public static final int MAX_CONCURRENT_CONSTRUCTION = 3;

    // Production model
    public static final double POPULATION_BONUS_BASELINE = 10.0;
    public static final double POPULATION_BONUS_PER_CAPITA = 0.02;
    public static final double POPULATION_BONUS_CAP = 2.0;
    public static final double BUILDING_BONUS_PER_BUILDING = 0.1;
    public static final double BUILDING_BONUS_CAP = 1.5;
    public static final double FOOD_YIELD_FACTOR = 0.1;
    public static final double WOOD_YIELD_FACTOR = 0.08;
    public static final double ORE_YIELD_FACTOR = 0.05;

    // Consumption model
    public static final double CONSUMPTION_EFFICIENCY_PER_CAPITA = 0.002;
    public static final double CONSUMPTION_EFFICIENCY_FLOOR = 0.8;

    // Classification without consumption (absolute stock bands)
    public static final double IDLE_STOCK_SURPLUS_BAND = 50.0;
    public static final double IDLE_STOCK_BALANCED_BAND = 20.0;
    public static final double IDLE_STOCK_SHORTAGE_BAND = 5.0;

    // Classification with consumption (stock expressed in days of consumption)
    public static final double CRITICAL_STOCK_DAYS = 1.0;
    public static final double SHORTAGE_STOCK_DAYS = 5.0;
    public static final double SURPLUS_STOCK_DAYS = 10.0;

    /** Fraction of required consumption below which a critical village starves. */
    public static final double STARVATION_PRODUCTION_RATIO = 0.3;

    // Harvest efficiency curve
    public static final double HARVEST_FULL_EFFICIENCY_RATIO = 0.8;
    public static final double HARVEST_MIN_EFFICIENCY_RATIO = 0.3;
    public static final double HARVEST_MIN_EFFICIENCY = 0.1;
    public static final double HARVEST_BASE_AMOUNT = 1.0;
    public static final double HARVEST_PRIORITY_STEP = 0.25;
    public static final double HARVEST_MIN_AMOUNT = 0.1;

    // Collection radius adjustments on population change
    public static final int RADIUS_POPULATION_STEP = 20;
    public static final int MAX_GROWTH_RADIUS = 4;

    // Supplier search
    public static final double SUPPLIER_RESERVE_DAYS = 3.0;
    public static final double SUPPLIER_STOCK_SHARE = 0.1;
    public static final double SUPPLIER_MIN_DISTANCE_FACTOR = 0.1;
}
