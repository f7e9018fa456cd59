package io.github.yok.jw.core.term;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import lombok.Value;

/**
 * フェルミオン項（スピン軌道インデックスの順序付き列）を表す値オブジェクトです。
 *
 * <p>
 * 各インデックスは生成・消滅演算子のオペランドであり、演算子の種類の並びは {@link FermionTermType} によって決まります。
 * 生成後は不変です。
 * </p>
 */
@Value
public class FermionTerm {

    /**
     * スピン軌道インデックス列です（0 以上）。
     */
    ImmutableList<Integer> indices;

    private FermionTerm(ImmutableList<Integer> indices) {
        this.indices = indices;
    }

    /**
     * インデックス列からフェルミオン項を生成します。
     *
     * @param indices スピン軌道インデックス列です（null 不可、各要素 0 以上）
     * @return フェルミオン項です
     * @throws NullPointerException indices が null の場合に発生します
     * @throws IllegalArgumentException 負のインデックスを含む場合に発生します
     */
    public static FermionTerm of(int... indices) {
        checkNotNull(indices, "indices は null 不可です");
        for (int index : indices) {
            checkArgument(index >= 0, "スピン軌道インデックスは 0 以上が必要です: %s", index);
        }
        return new FermionTerm(ImmutableList.copyOf(Ints.asList(indices)));
    }

    /**
     * インデックス数を返します。
     *
     * @return インデックス数です
     */
    public int size() {
        return indices.size();
    }

    /**
     * 指定位置のインデックスを返します。
     *
     * @param position 位置です（0 以上 size 未満）
     * @return スピン軌道インデックスです
     */
    public int indexAt(int position) {
        return indices.get(position);
    }

    /**
     * インデックス列の作業用コピーを返します。
     *
     * @return 新しい配列です
     */
    public int[] toArray() {
        return Ints.toArray(indices);
    }
}
