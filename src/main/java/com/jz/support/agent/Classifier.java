package com.jz.support.agent;

import com.jz.support.domain.Classification;

public interface Classifier {
    /** 返回值的主分类一定在已知集合内 */
    Classification classify(String message);
}
