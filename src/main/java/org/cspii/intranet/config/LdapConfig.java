package org.cspii.intranet.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.ldap.core.LdapTemplate;
import org.springframework.ldap.core.support.LdapContextSource;

import java.util.Map;

@Configuration
@Profile("!test")
public class LdapConfig {

    @Value("${app.client.ldap.url}")
    private String ldapUrl;

    @Value("${app.client.ldap.base}")
    private String ldapBase;

    @Value("${app.client.ldap.username}")
    private String ldapUsername;

    @Value("${app.client.ldap.password}")
    private String ldapPassword;

    @Bean
    public LdapContextSource contextSource() {
        LdapContextSource contextSource = new LdapContextSource();
        contextSource.setUrl(ldapUrl);
        contextSource.setBase(ldapBase);
        contextSource.setUserDn(ldapUsername);
        contextSource.setPassword(ldapPassword);
        // description values come back as raw bytes and are decoded by LdapUtils
        contextSource.setBaseEnvironmentProperties(
                Map.of("java.naming.ldap.attributes.binary", "description"));
        return contextSource;
    }

    @Bean
    public LdapTemplate ldapTemplate() {
        LdapTemplate template = new LdapTemplate(contextSource());
        template.setIgnorePartialResultException(true);
        return template;
    }
}
