package com.lyshra.open.cms.core.exception.promotion;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;

public class PromotionCancelledException extends LyshraOpenCmsException {

    public PromotionCancelledException(String reason) {
        super(LyshraOpenCmsErrorKind.CANCELLED, "Promotion cancelled: " + reason);
    }
}
