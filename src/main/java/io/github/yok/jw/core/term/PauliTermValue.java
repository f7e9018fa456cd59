package io.github.yok.jw.core.term;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import java.util.Arrays;

/**
 * Pauli 項の係数を表す不変の実数ベクトルです。
 *
 * <p>
 * 通常の Pauli 項は長さ 1、{@link PauliTermType#V01234} は長さ 4 の係数を持ちます。
 * 同一の Pauli 項が繰り返し現れた場合は成分ごとに加算します。
 * </p>
 */
public final class PauliTermValue {

    /**
     * 係数成分です。外部へは複製して渡します。
     */
    private final double[] values;

    private PauliTermValue(double[] values) {
        this.values = values;
    }

    /**
     * 係数ベクトルを生成します。
     *
     * @param values 係数成分です（null 不可、長さ 1 以上）
     * @return 係数ベクトルです
     * @throws NullPointerException values が null の場合に発生します
     * @throws IllegalArgumentException values が空の場合に発生します
     */
    public static PauliTermValue of(double... values) {
        checkNotNull(values, "values は null 不可です");
        checkArgument(values.length > 0, "係数は 1 成分以上が必要です");
        return new PauliTermValue(values.clone());
    }

    /**
     * 成分数を返します。
     *
     * @return 成分数です
     */
    public int size() {
        return values.length;
    }

    /**
     * 指定成分を返します。
     *
     * @param component 成分番号です（0 以上 size 未満）
     * @return 係数成分です
     */
    public double get(int component) {
        return values[component];
    }

    /**
     * 成分の複製を返します。
     *
     * @return 係数成分の配列です
     */
    public double[] toArray() {
        return values.clone();
    }

    /**
     * 成分ごとの和を返します。
     *
     * @param other 加算する係数です（null 不可、成分数が一致すること）
     * @return 和です
     * @throws IllegalArgumentException 成分数が一致しない場合に発生します
     */
    public PauliTermValue plus(PauliTermValue other) {
        checkNotNull(other, "other は null 不可です");
        checkArgument(other.values.length == values.length, "係数の成分数が一致しません: %s != %s",
                values.length, other.values.length);
        double[] sum = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            sum[i] = values[i] + other.values[i];
        }
        return new PauliTermValue(sum);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PauliTermValue)) {
            return false;
        }
        return Arrays.equals(values, ((PauliTermValue) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
