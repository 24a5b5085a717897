package com.banchess.gameservice.games.banchess.interfaces.ws;

import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.interfaces.ws.dto.BanChessMessages.ActionCmd;
import com.banchess.gameservice.games.banchess.interfaces.ws.dto.BanChessMessages.AuthenticateCmd;
import com.banchess.gameservice.games.banchess.interfaces.ws.dto.BanChessMessages.CreateSoloCmd;
import com.banchess.gameservice.games.banchess.interfaces.ws.dto.BanChessMessages.GiveTimeCmd;
import com.banchess.gameservice.games.banchess.interfaces.ws.dto.BanChessMessages.JoinQueueCmd;
import com.banchess.gameservice.games.banchess.interfaces.ws.dto.BanChessMessages.SessionCmd;
import com.banchess.gameservice.games.banchess.service.BanChessService;
import com.banchess.gameservice.platform.auth.Credentials;
import com.banchess.gameservice.platform.connection.ConnectionMultiplexer;
import com.banchess.gameservice.platform.transport.ServerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Ban Chess WebSocket 控制器
 * ----------------------------------------
 * 接收客户端通过 STOMP 发送的指令（/app/banchess.*），交给服务层处理。
 * 成功后的状态由广播推送；这里只负责把拒绝原因以 error{code,message} 回给发送方。
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class BanChessWsController {

    private final BanChessService banChessService;
    private final ConnectionMultiplexer multiplexer;

    @MessageMapping("/banchess.authenticate")
    public void authenticate(AuthenticateCmd cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        try {
            banChessService.authenticate(connectionId,
                    new Credentials(cmd.getToken(), cmd.getUserId(), cmd.getUsername()));
        } catch (Exception e) {
            sendError(connectionId, e);
        }
    }

    @MessageMapping("/banchess.create-solo-game")
    public void createSolo(CreateSoloCmd cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        try {
            banChessService.createSolo(connectionId, cmd == null ? null : cmd.getTimeControl());
        } catch (Exception e) {
            sendError(connectionId, e);
        }
    }

    @MessageMapping("/banchess.join-queue")
    public void joinQueue(JoinQueueCmd cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        try {
            banChessService.joinQueue(connectionId, cmd == null ? null : cmd.timeControl());
        } catch (Exception e) {
            sendError(connectionId, e);
        }
    }

    @MessageMapping("/banchess.leave-queue")
    public void leaveQueue(SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        try {
            banChessService.leaveQueue(connectionId);
        } catch (Exception e) {
            sendError(connectionId, e);
        }
    }

    @MessageMapping("/banchess.attach")
    public void attach(SessionCmd cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        try {
            replyOnFailure(connectionId, banChessService.attach(connectionId, cmd.getSessionId()));
        } catch (Exception e) {
            sendError(connectionId, e);
        }
    }

    @MessageMapping("/banchess.detach")
    public void detach(SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        try {
            banChessService.detach(connectionId);
        } catch (Exception e) {
            sendError(connectionId, e);
        }
    }

    /**
     * 禁着/走子。
     * 流程：校验载荷 → 投递到对局信箱 → 成功由广播推送新快照，失败只回给发送方。
     */
    @MessageMapping("/banchess.action")
    public void action(ActionCmd cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        try {
            replyOnFailure(connectionId,
                    banChessService.submitAction(connectionId, cmd.getSessionId(), cmd.toAction()));
        } catch (Exception e) {
            sendError(connectionId, e);
        }
    }

    @MessageMapping("/banchess.resign")
    public void resign(SessionCmd cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        try {
            replyOnFailure(connectionId, banChessService.resign(connectionId, cmd.getSessionId()));
        } catch (Exception e) {
            sendError(connectionId, e);
        }
    }

    @MessageMapping("/banchess.offer-draw")
    public void offerDraw(SessionCmd cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        try {
            replyOnFailure(connectionId, banChessService.offerDraw(connectionId, cmd.getSessionId()));
        } catch (Exception e) {
            sendError(connectionId, e);
        }
    }

    @MessageMapping("/banchess.give-time")
    public void giveTime(GiveTimeCmd cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        try {
            replyOnFailure(connectionId,
                    banChessService.giveTime(connectionId, cmd.getSessionId(), cmd.getAmount()));
        } catch (Exception e) {
            sendError(connectionId, e);
        }
    }

    /**
     * 载荷无法反序列化：协议错误，只回给发送方。
     */
    @MessageExceptionHandler(MessageConversionException.class)
    public void handleConversion(MessageConversionException e, SimpMessageHeaderAccessor sha) {
        multiplexer.send(sha.getSessionId(), ServerEvent.error(ErrorCode.PROTOCOL.name(), "malformed message"));
    }

    // ---------------------------------------------------------------- 回执

    private void replyOnFailure(String connectionId, CompletableFuture<?> future) {
        future.whenComplete((r, ex) -> {
            if (ex != null) {
                sendError(connectionId, ex);
            }
        });
    }

    private void sendError(String connectionId, Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof GameException ge) {
            multiplexer.send(connectionId, ServerEvent.error(ge.getCode().name(), ge.getMessage()));
            return;
        }
        if (cause instanceof NullPointerException || cause instanceof IllegalArgumentException) {
            multiplexer.send(connectionId, ServerEvent.error(ErrorCode.PROTOCOL.name(), cause.getMessage()));
            return;
        }
        log.error("处理指令失败: connectionId={}", connectionId, cause);
        multiplexer.send(connectionId, ServerEvent.error(ErrorCode.INTERNAL.name(), cause.getMessage()));
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
