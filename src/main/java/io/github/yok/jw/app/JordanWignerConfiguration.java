package io.github.yok.jw.app;

import io.github.yok.jw.core.encoder.JordanWignerTermEncoder;
import io.github.yok.jw.core.encoder.PermutationClassifier;
import io.github.yok.jw.core.encoder.TermEncoder;
import io.github.yok.jw.core.transform.JordanWignerTransformer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * フェルミオン → Pauli 変換の Bean 定義を行う設定クラスです。
 *
 * <p>
 * 設定値（jw.*）に従って置換分類器・エンコーダ・変換器を組み立てます。
 * </p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(TransformerProperties.class)
@RequiredArgsConstructor
public class JordanWignerConfiguration {

    /**
     * Pauli 変換の設定値（jw.*）です。
     */
    private final TransformerProperties p;

    /**
     * PQRS 項の置換分類器を生成します。
     *
     * @return 置換分類器です
     */
    @Bean
    public PermutationClassifier permutationClassifier() {
        return new PermutationClassifier();
    }

    /**
     * 設定された写像のエンコーダを生成します。
     *
     * @param permutationClassifier 置換分類器です
     * @return エンコーダです
     */
    @Bean
    public TermEncoder termEncoder(PermutationClassifier permutationClassifier) {
        switch (p.getEncoding()) {
            case JORDAN_WIGNER:
                return new JordanWignerTermEncoder(permutationClassifier);
            default:
                throw new IllegalStateException("未対応の encoding です: " + p.getEncoding());
        }
    }

    /**
     * 変換器を生成します。
     *
     * @param termEncoder エンコーダです
     * @return 変換器です
     */
    @Bean
    public JordanWignerTransformer jordanWignerTransformer(TermEncoder termEncoder) {
        log.info("Pauli 変換の設定です。{}", p.toMultilineString());
        return new JordanWignerTransformer(termEncoder, p.getTransform().getParallelism());
    }
}
