package com.pareview.app.integration.contract;

import com.pareview.app.integration.enumerations.ReviewErrorCategory;

public interface IPaReviewErrorInfo {
    String getErrorCode();
    ReviewErrorCategory getCategory();
    String getErrorTemplate();
    String getResolutionTemplate();
}
