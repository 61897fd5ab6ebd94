package command;

import protocol.RespValue;
import service.StorageService;

/**
 * 파싱이 끝난 클라이언트 요청 하나. 한 번만 실행됩니다.
 * 인자 바이트 배열은 복사하지 않고 요청 프레임과 공유하므로, 값을 보관하는 쪽(저장소)이 복사합니다.
 */
public sealed interface Command permits PingCommand, EchoCommand, SetCommand, GetCommand, RpushCommand {

    /**
     * 명령어 실행 로직
     * @param storageService 공유 저장소
     * @return 클라이언트에게 보낼 응답 값
     */
    RespValue execute(StorageService storageService);
}
