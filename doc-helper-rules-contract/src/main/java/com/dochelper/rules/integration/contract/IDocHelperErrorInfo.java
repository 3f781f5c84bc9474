package com.dochelper.rules.integration.contract;

public interface IDocHelperErrorInfo {
    String getErrorCode();
    String getErrorTemplate();
    String getResolutionTemplate();
}
