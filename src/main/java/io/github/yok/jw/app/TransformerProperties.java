package io.github.yok.jw.app;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pauli 変換の設定値（jw.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、エンコーダと変換器の組み立てに使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "jw")
public class TransformerProperties {

    /**
     * フェルミオンから量子ビットへの写像です。
     */
    @NotNull
    private Encoding encoding = Encoding.JORDAN_WIGNER;

    /**
     * 変換処理の設定です。
     */
    @Valid
    private Transform transform = new Transform();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "jw")
    public String toMultilineString() {
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder(128).append(nl);

        sb.append("  encoding: ").append(getEncoding()).append(nl);

        appendSection(sb, nl, "transform",
                // parallelism: 項ごとの展開に使う並列度（1 は逐次）
                "parallelism", getTransform().getParallelism());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    /**
     * フェルミオンから量子ビットへの写像の種類です。
     */
    public enum Encoding {
        JORDAN_WIGNER
    }

    @Data
    public static class Transform {

        /**
         * 項ごとの展開に使う並列度です（1 は逐次）。
         */
        @Min(1)
        private int parallelism = 1;
    }
}
