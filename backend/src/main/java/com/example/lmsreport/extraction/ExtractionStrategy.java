package com.example.lmsreport.extraction;

import java.util.List;

/**
 * ページ内容から候補エンティティ (コースや課題) を取り出す抽出戦略。
 * 実装は不正な入力でも例外を投げず、空のリストを返すこと。
 *
 * @param <I> 入力 (ページのスナップショットなど)
 * @param <C> 候補の型
 */
public interface ExtractionStrategy<I, C> {

    /** ログやプロファイルの strategy_order で使う識別子。 */
    String name();

    List<C> extract(I input);
}
