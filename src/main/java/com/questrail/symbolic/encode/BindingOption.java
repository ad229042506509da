package com.questrail.symbolic.encode;

import java.util.EnumSet;
import java.util.Set;

/**
 * Shape options for {@link ExpressionBuilder#buildBinding}.
 *
 * <p>{@link #LAST_OUTPUT}/{@link #ALL_OUTPUT} choose what the body yields;
 * {@link #SERIAL}/{@link #PARALLEL} choose whether it is submitted for parallel
 * evaluation. Each pair is mutually exclusive.</p>
 */
public enum BindingOption
{
    /** Body joined with {@code CompoundExpression}; yields only the last result. */
    LAST_OUTPUT,
    /** Body joined with {@code List}; yields every result. */
    ALL_OUTPUT,
    SERIAL,
    /** Body wrapped in {@code ParallelSubmit} over the bound variables. */
    PARALLEL;

    static Set<BindingOption> resolve(BindingOption... options) {
        Set<BindingOption> set = EnumSet.noneOf(BindingOption.class);
        for (BindingOption option : options) {
            if (option == null) {
                throw new NullPointerException("option");
            }
            set.add(option);
        }
        if (set.contains(LAST_OUTPUT) && set.contains(ALL_OUTPUT)) {
            throw new IllegalArgumentException("LAST_OUTPUT and ALL_OUTPUT are mutually exclusive");
        }
        if (set.contains(SERIAL) && set.contains(PARALLEL)) {
            throw new IllegalArgumentException("SERIAL and PARALLEL are mutually exclusive");
        }
        return set;
    }
}
