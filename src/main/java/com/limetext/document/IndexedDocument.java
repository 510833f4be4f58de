package com.limetext.document;

import com.limetext.text.Token;
import com.limetext.text.Tokenizer;
import com.limetext.text.WordBoundaryTokenizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 带特征索引的文档。
 *
 * 原文被切分为词与分隔符交替的片段，词片段按 {@link IndexMode} 编号为特征，
 * 特征编号从 0 开始按首次出现顺序连续分配。分隔符永远不是特征。
 * 构建完成后不可变。
 */
public final class IndexedDocument {
    private static final Tokenizer TOKENIZER = new WordBoundaryTokenizer();

    private final String raw;
    private final IndexMode mode;
    private final String[] tokenTerms;
    /** 片段起始字符偏移，即片段长度的前缀和 */
    private final int[] tokenStarts;
    private final List<String> inverseVocab;
    /** 特征编号 -> 片段下标，位置模式下每个特征只有一个下标 */
    private final List<int[]> positions;

    private IndexedDocument(String raw, IndexMode mode, String[] tokenTerms, int[] tokenStarts,
                            List<String> inverseVocab, List<int[]> positions) {
        this.raw = raw;
        this.mode = mode;
        this.tokenTerms = tokenTerms;
        this.tokenStarts = tokenStarts;
        this.inverseVocab = inverseVocab;
        this.positions = positions;
    }

    /**
     * 切分并索引原文。
     */
    public static IndexedDocument of(String raw, IndexMode mode) {
        if (raw == null) {
            throw new IllegalArgumentException("文档内容不能为null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("索引模式不能为null");
        }

        List<Token> tokens = TOKENIZER.tokenize(raw);
        String[] tokenTerms = new String[tokens.size()];
        int[] tokenStarts = new int[tokens.size()];
        int cursor = 0;
        for (int index = 0; index < tokens.size(); index++) {
            tokenTerms[index] = tokens.get(index).term();
            tokenStarts[index] = cursor;
            cursor += tokens.get(index).length();
        }

        Map<String, Integer> vocab = new HashMap<>();
        List<String> inverseVocab = new ArrayList<>();
        List<List<Integer>> occurrences = new ArrayList<>();
        Set<String> nonVocab = new HashSet<>();

        for (int index = 0; index < tokenTerms.length; index++) {
            String term = tokenTerms[index];
            if (nonVocab.contains(term)) {
                continue;
            }
            if (WordBoundaryTokenizer.isNonWord(term)) {
                nonVocab.add(term);
                continue;
            }
            if (mode == IndexMode.BOW) {
                Integer featureId = vocab.get(term);
                if (featureId == null) {
                    featureId = inverseVocab.size();
                    vocab.put(term, featureId);
                    inverseVocab.add(term);
                    occurrences.add(new ArrayList<>());
                }
                occurrences.get(featureId).add(index);
            } else {
                inverseVocab.add(term);
                occurrences.add(List.of(index));
            }
        }

        List<int[]> positions = new ArrayList<>(occurrences.size());
        for (List<Integer> tokenIndexes : occurrences) {
            positions.add(tokenIndexes.stream().mapToInt(Integer::intValue).toArray());
        }
        return new IndexedDocument(raw, mode, tokenTerms, tokenStarts, List.copyOf(inverseVocab), List.copyOf(positions));
    }

    public String rawString() {
        return raw;
    }

    public IndexMode mode() {
        return mode;
    }

    public int numTokens() {
        return tokenTerms.length;
    }

    /**
     * 可扰动特征数量。
     */
    public int numFeatures() {
        return inverseVocab.size();
    }

    public String featureText(int featureId) {
        checkFeatureId(featureId);
        return inverseVocab.get(featureId);
    }

    /**
     * 返回特征在原文中每次出现的起始偏移。
     *
     * 偏移是 {@link String} 下标（UTF-16 代码单元），可直接用于 {@code substring}；
     * 原文含增补平面字符（如 emoji）时与码点计数不同。
     */
    public int[] featurePositions(int featureId) {
        checkFeatureId(featureId);
        int[] tokenIndexes = positions.get(featureId);
        int[] offsets = new int[tokenIndexes.length];
        for (int index = 0; index < tokenIndexes.length; index++) {
            offsets[index] = tokenStarts[tokenIndexes[index]];
        }
        return offsets;
    }

    public List<FeatureInfo> features() {
        List<FeatureInfo> features = new ArrayList<>(numFeatures());
        for (int featureId = 0; featureId < numFeatures(); featureId++) {
            features.add(new FeatureInfo(featureId, inverseVocab.get(featureId), featurePositions(featureId)));
        }
        return features;
    }

    /**
     * 删除指定特征的全部片段后按原顺序拼接剩余片段。
     * 特征集合为空时返回原文。
     */
    public String remove(int... featureIds) {
        if (featureIds == null || featureIds.length == 0) {
            return raw;
        }
        for (int featureId : featureIds) {
            checkFeatureId(featureId);
        }

        boolean[] removed = new boolean[tokenTerms.length];
        for (int featureId : featureIds) {
            for (int tokenIndex : positions.get(featureId)) {
                removed[tokenIndex] = true;
            }
        }

        StringBuilder builder = new StringBuilder(raw.length());
        for (int index = 0; index < tokenTerms.length; index++) {
            if (!removed[index]) {
                builder.append(tokenTerms[index]);
            }
        }
        return builder.toString();
    }

    public String remove(Collection<Integer> featureIds) {
        if (featureIds == null) {
            return raw;
        }
        int[] ids = new int[featureIds.size()];
        int cursor = 0;
        for (Integer featureId : featureIds) {
            // null 编号按越界处理，取 -1 使其被 checkFeatureId 拒绝
            ids[cursor++] = featureId == null ? -1 : featureId;
        }
        return remove(ids);
    }

    private void checkFeatureId(int featureId) {
        if (featureId < 0 || featureId >= inverseVocab.size()) {
            throw new InvalidFeatureIdException(featureId, inverseVocab.size());
        }
    }
}
