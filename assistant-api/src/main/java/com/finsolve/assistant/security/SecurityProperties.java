package com.finsolve.assistant.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat.security")
public class SecurityProperties {

    /**
     * Optional static bearer token used to authenticate requests when configured.
     */
    private String staticToken;

    /**
     * User id assigned to requests authenticated with the static token.
     */
    private String staticUser = "static-user";

    /**
     * Department role assigned to requests authenticated with the static token.
     */
    private String staticRole = "Employee";

    /**
     * JWT claim used as the user id when no static token is configured.
     */
    private String userClaim = "sub";

    public String getStaticToken() {
        return staticToken;
    }

    public void setStaticToken(String staticToken) {
        this.staticToken = staticToken;
    }

    public String getStaticUser() {
        return staticUser;
    }

    public void setStaticUser(String staticUser) {
        this.staticUser = staticUser;
    }

    public String getStaticRole() {
        return staticRole;
    }

    public void setStaticRole(String staticRole) {
        this.staticRole = staticRole;
    }

    public String getUserClaim() {
        return userClaim;
    }

    public void setUserClaim(String userClaim) {
        this.userClaim = userClaim;
    }

    public boolean hasStaticToken() {
        return staticToken != null && !staticToken.isBlank();
    }
}
