package za.ac.salt.saltuser;

import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import za.ac.salt.saltuser.authn.PiptAuthenticationProvider;
import za.ac.salt.saltuser.authz.ProposalSecurity;
import za.ac.salt.saltuser.user.SaltUserService;

/**
 * Registers the user service and the Spring Security integration. The application has to provide a
 * {@link za.ac.salt.saltuser.spi.DataGateway} bean, for example by importing the JDBC gateway configuration.
 */
@Configuration
@ComponentScan(basePackageClasses = {SaltUserService.class, ProposalSecurity.class, PiptAuthenticationProvider.class})
public class SaltUserConfiguration {
}
