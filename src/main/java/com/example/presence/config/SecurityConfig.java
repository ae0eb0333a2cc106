package com.example.presence.config;

import com.example.presence.security.HmacAuthenticationFilter;
import com.example.presence.security.HmacSignatureVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
public class SecurityConfig {

    @Bean
    public BCryptPasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public InMemoryUserDetailsManager adminUsers(@Value("${presence.admin.username}") String username,
                                                 @Value("${presence.admin.password}") String password,
                                                 BCryptPasswordEncoder passwordEncoder) {
        UserDetails admin = User.withUsername(username)
                .password(passwordEncoder.encode(password))
                .roles("ADMIN")
                .build();
        return new InMemoryUserDetailsManager(admin);
    }

    /**
     * Devices sign /presence/** with HMAC, administrators use HTTP Basic for everything else.
     * No sessions: every request carries its own credentials.
     */
    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http,
                                           HmacSignatureVerifier hmacSignatureVerifier,
                                           ObjectMapper objectMapper) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(s -> s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.GET, "/", "/geofence", "/time-windows").permitAll()
                        .requestMatchers("/error", "/actuator/health", "/actuator/prometheus").permitAll()
                        .requestMatchers("/presence/**").hasRole("DEVICE")
                        .anyRequest().hasRole("ADMIN")
                )
                .httpBasic(Customizer.withDefaults())
                .addFilterBefore(new HmacAuthenticationFilter(hmacSignatureVerifier, objectMapper),
                        UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
