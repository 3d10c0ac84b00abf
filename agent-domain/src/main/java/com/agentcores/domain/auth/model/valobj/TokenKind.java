package com.agentcores.domain.auth.model.valobj;

/**
 * 令牌种类，对应 typ 声明。
 */
public enum TokenKind {

    ACCESS("access"),

    REFRESH("refresh");

    private final String claim;

    TokenKind(String claim) {
        this.claim = claim;
    }

    public String getClaim() {
        return claim;
    }

    public static TokenKind fromClaim(String claim) {
        for (TokenKind kind : values()) {
            if (kind.claim.equals(claim)) {
                return kind;
            }
        }
        return null;
    }
}
