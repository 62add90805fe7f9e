package leaveflow.leaveflowbackend.provider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;

/**
 * 토큰은 사내 인증 서버가 같은 secret-key 로 발급한다. 여기서는 검증이 주 용도
 */
@Slf4j
@Service
public class JwtProvider {

    @Value("${secret-key}")
    private String secretKey;

    @Value("${jwt.access-token.expiration:86400000}") // 24시간
    private Long accessTokenExpiration;

    // 사내 인증 서버와 맞춰야 한다
    @Value("${jwt.issuer:leaveflow-auth}")
    private String issuer;

    private Key signingKey;

    @PostConstruct
    public void init() {
        this.signingKey = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
    }

    public String create(String employeeId, String role) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + accessTokenExpiration);

        Claims claims = Jwts.claims().setSubject(employeeId);
        claims.put("role", role);
        claims.put("type", "access");

        log.debug("Creating access token for employeeId: {}, expires at: {}", employeeId, expiryDate);
        return Jwts.builder()
                .setClaims(claims)
                .setIssuer(issuer)
                .setIssuedAt(now)
                .setExpiration(expiryDate)
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * 유효하면 subject(사번), 아니면 null
     */
    public String validate(String token) {
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .requireIssuer(issuer)
                    .setAllowedClockSkewSeconds(30)
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            return claims.getSubject();
        } catch (ExpiredJwtException e) {
            log.warn("Access token expired: {}", e.getMessage());
            return null;
        } catch (Exception e) {
            log.warn("Invalid access token: {}", e.getMessage());
            return null;
        }
    }
}
