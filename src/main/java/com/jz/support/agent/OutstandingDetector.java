package com.jz.support.agent;

import com.jz.support.domain.Category;
import com.jz.support.domain.OutstandingResult;

public interface OutstandingDetector {
    OutstandingResult detect(String message, Category category);
}
